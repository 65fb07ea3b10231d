package com.systemlogger.sink;

import static com.google.common.base.Strings.isNullOrEmpty;

import com.google.common.annotations.VisibleForTesting;
import com.google.errorprone.annotations.ThreadSafe;
import com.systemlogger.Severity;
import com.systemlogger.SystemLogger;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Writes entries to {@code java.util.logging}.
 *
 * <p>Entries go to the logger named {@code subsystem.category} (just {@code category} when the
 * subsystem is empty) as {@link SystemLogRecord}s, so level filtering, handlers and formatting
 * stay under the control of the JUL configuration of the host. The source class and method of
 * each record are those of the code that called the {@link SystemLogger}.
 */
@ThreadSafe
public final class JulLogSink implements LogSink {

  private static final StackWalker stackWalker =
      StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);

  // LogManager only holds loggers weakly; levels set on a collected logger are lost.
  private final ConcurrentMap<String, Logger> loggers = new ConcurrentHashMap<>();

  /** Creates a sink writing to the JUL logger hierarchy. */
  public static JulLogSink create() {
    return new JulLogSink();
  }

  private JulLogSink() {}

  @Override
  public void emit(
      Severity severity, String subsystem, String category, String message, boolean redacted) {
    Logger logger = loggerFor(subsystem, category);
    if (!logger.isLoggable(severity.level())) {
      return;
    }
    SystemLogRecord record = new SystemLogRecord(severity, subsystem, category, message, redacted);
    record.setLoggerName(logger.getName());
    StackWalker.@Nullable StackFrame caller = callerFrame();
    record.setSourceClassName(caller == null ? null : caller.getClassName());
    record.setSourceMethodName(caller == null ? null : caller.getMethodName());
    logger.log(record);
  }

  /** Returns the first frame outside {@link SystemLogger} and the sinks. */
  private static StackWalker.@Nullable StackFrame callerFrame() {
    return stackWalker.walk(
        frames -> frames.filter(frame -> !isLoggingFrame(frame.getDeclaringClass()))
            .findFirst()
            .orElse(null));
  }

  @VisibleForTesting
  static boolean isLoggingFrame(Class<?> declaringClass) {
    return declaringClass == SystemLogger.class || LogSink.class.isAssignableFrom(declaringClass);
  }

  @VisibleForTesting
  Logger loggerFor(String subsystem, String category) {
    return loggers.computeIfAbsent(loggerName(subsystem, category), Logger::getLogger);
  }

  static String loggerName(String subsystem, String category) {
    return isNullOrEmpty(subsystem) ? category : subsystem + "." + category;
  }
}
