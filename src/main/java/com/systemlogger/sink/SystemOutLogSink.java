package com.systemlogger.sink;

import com.systemlogger.Severity;
import java.io.PrintStream;

/** Log directly to System.out. */
public class SystemOutLogSink implements LogSink {
  /** Creates a sink printing to {@link System#out}. */
  public static LogSink create() {
    return new SystemOutLogSink(System.out);
  }

  /** Creates a sink printing to {@code out}. */
  public static LogSink create(PrintStream out) {
    return new SystemOutLogSink(out);
  }

  private final PrintStream out;

  protected SystemOutLogSink(PrintStream out) {
    this.out = out;
  }

  @Override
  public void emit(
      Severity severity, String subsystem, String category, String message, boolean redacted) {
    out.printf(
        "[%s] %s/%s: %s%n",
        severity.level().getName(),
        subsystem,
        category,
        redacted ? SystemLogRecord.REDACTED_PLACEHOLDER : message);
  }
}
