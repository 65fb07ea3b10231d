package com.systemlogger.sink;

import com.systemlogger.Severity;

/**
 * The logging facility that actually writes entries.
 *
 * <p>Implementations must be safe for concurrent use. A sink owns its own failure handling;
 * callers treat every emit as fire-and-forget.
 */
public interface LogSink {

  /**
   * Writes one entry.
   *
   * @param severity severity of the entry
   * @param subsystem owner of the log stream, possibly empty
   * @param category subdivision of the subsystem, never empty
   * @param message payload of the entry
   * @param redacted whether viewers must hide {@code message} unless explicitly revealed
   */
  void emit(
      Severity severity, String subsystem, String category, String message, boolean redacted);
}
