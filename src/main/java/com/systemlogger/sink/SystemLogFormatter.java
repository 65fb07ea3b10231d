package com.systemlogger.sink;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.logging.Formatter;
import java.util.logging.LogRecord;

/**
 * Renders records as {@code [LEVEL] subsystem/category: message}.
 *
 * <p>Redacted {@link SystemLogRecord}s render as {@code <private>} unless the formatter was
 * created with {@link #revealing()} or is a {@link RevealingSystemLogFormatter}. Records from other sources render with their logger name in
 * place of {@code subsystem/category}.
 */
public class SystemLogFormatter extends Formatter {
  private final boolean revealPrivate;

  public SystemLogFormatter() {
    this(false);
  }

  protected SystemLogFormatter(boolean revealPrivate) {
    this.revealPrivate = revealPrivate;
  }

  /** Creates a formatter that renders the payload of redacted records. */
  public static SystemLogFormatter revealing() {
    return new RevealingSystemLogFormatter();
  }

  public boolean revealsPrivate() {
    return revealPrivate;
  }

  @Override
  public String format(LogRecord record) {
    String source;
    String message;
    if (record instanceof SystemLogRecord) {
      SystemLogRecord systemRecord = (SystemLogRecord) record;
      source = systemRecord.getSubsystem() + "/" + systemRecord.getCategory();
      message =
          systemRecord.isRedacted() && revealPrivate
              ? systemRecord.revealMessage()
              : formatMessage(systemRecord);
    } else {
      source = String.valueOf(record.getLoggerName());
      message = formatMessage(record);
    }
    StringBuilder sb = new StringBuilder();
    sb.append('[').append(record.getLevel().getName()).append("] ");
    sb.append(source).append(": ").append(message).append(System.lineSeparator());
    if (record.getThrown() != null) {
      StringWriter sw = new StringWriter();
      PrintWriter pw = new PrintWriter(sw);
      record.getThrown().printStackTrace(pw);
      sb.append(sw);
    }
    return sb.toString();
  }
}
