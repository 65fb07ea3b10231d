package com.systemlogger.sink;

import com.systemlogger.Severity;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@link java.util.logging.LogRecord} written by {@link JulLogSink}.
 *
 * <p>For a redacted record {@link #getMessage()} returns {@link #REDACTED_PLACEHOLDER}, so any
 * handler or formatter unaware of this class hides the payload. {@link #revealMessage()} returns
 * the payload for viewers allowed to see it. The payload is not serialized: a deserialized
 * redacted record only reveals {@link #REDACTED_PLACEHOLDER}.
 */
public final class SystemLogRecord extends java.util.logging.LogRecord {
  private static final long serialVersionUID = 1L;

  public static final String REDACTED_PLACEHOLDER = "<private>";

  private final Severity severity;
  private final String subsystem;
  private final String category;
  private final boolean redacted;
  private final transient @Nullable String payload;

  SystemLogRecord(
      Severity severity, String subsystem, String category, String message, boolean redacted) {
    super(severity.level(), redacted ? REDACTED_PLACEHOLDER : message);
    this.severity = severity;
    this.subsystem = subsystem;
    this.category = category;
    this.redacted = redacted;
    this.payload = message;
  }

  public Severity getSeverity() {
    return severity;
  }

  public String getSubsystem() {
    return subsystem;
  }

  public String getCategory() {
    return category;
  }

  public boolean isRedacted() {
    return redacted;
  }

  /** Returns the payload, including for redacted records that were not deserialized. */
  public String revealMessage() {
    return payload == null ? getMessage() : payload;
  }
}
