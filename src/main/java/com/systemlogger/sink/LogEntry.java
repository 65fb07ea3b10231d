package com.systemlogger.sink;

import com.google.auto.value.AutoValue;
import com.systemlogger.Severity;

/** One emitted entry, as captured by {@link RecordingLogSink}. */
@AutoValue
public abstract class LogEntry {
  public static LogEntry create(
      Severity severity, String subsystem, String category, String message, boolean redacted) {
    return new AutoValue_LogEntry(severity, subsystem, category, message, redacted);
  }

  public abstract Severity severity();

  public abstract String subsystem();

  public abstract String category();

  public abstract String message();

  public abstract boolean redacted();
}
