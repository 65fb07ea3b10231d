package com.systemlogger.sink;

/**
 * A {@link SystemLogFormatter} that renders the payload of redacted records.
 *
 * <p>Can be named in a JUL configuration file, for example {@code
 * java.util.logging.ConsoleHandler.formatter=com.systemlogger.sink.RevealingSystemLogFormatter}.
 */
public final class RevealingSystemLogFormatter extends SystemLogFormatter {
  public RevealingSystemLogFormatter() {
    super(true);
  }
}
