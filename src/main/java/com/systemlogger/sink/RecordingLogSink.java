package com.systemlogger.sink;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.ThreadSafe;
import com.systemlogger.Severity;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.concurrent.GuardedBy;

/**
 * Keeps every entry in memory instead of writing it anywhere.
 *
 * <p>Meant to be injected where a test needs to observe what a logger emitted.
 */
@ThreadSafe
public final class RecordingLogSink implements LogSink {
  @GuardedBy("this")
  private final List<LogEntry> entries = new ArrayList<>();

  public static RecordingLogSink create() {
    return new RecordingLogSink();
  }

  private RecordingLogSink() {}

  @Override
  public void emit(
      Severity severity, String subsystem, String category, String message, boolean redacted) {
    LogEntry entry = LogEntry.create(severity, subsystem, category, message, redacted);
    synchronized (this) {
      entries.add(entry);
    }
  }

  /** Returns the entries recorded so far, in emission order. */
  public synchronized ImmutableList<LogEntry> entries() {
    return ImmutableList.copyOf(entries);
  }

  public synchronized void clear() {
    entries.clear();
  }
}
