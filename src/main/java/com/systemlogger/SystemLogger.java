package com.systemlogger;

import static com.google.common.base.Strings.isNullOrEmpty;

import com.google.common.base.MoreObjects;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.ThreadSafe;
import com.systemlogger.sink.LogSink;
import java.util.logging.ErrorManager;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Structured, leveled logging tagged with a subsystem and a category.
 *
 * <p>The subsystem identifies the owner of the log stream, typically the application; the
 * category identifies an area within it, such as {@code "Networking"}. Both are fixed at
 * construction and attached to every entry.
 *
 * <p>Messages logged with {@link #logPrivate(String)} are marked as redacted: viewers hide them
 * unless explicitly allowed to reveal private content. All other messages are public.
 *
 * <p>Logging never throws. A failure of the underlying {@link LogSink} is reported once through
 * {@link ErrorManager} and otherwise ignored.
 *
 * <pre>{@code
 * SystemLogger network = SystemLogger.create("com.example.myapp.network", "Networking");
 * network.logInfo("Network request started");
 * }</pre>
 *
 * <p>Instances are immutable and safe for use from any number of threads.
 */
@ThreadSafe
public final class SystemLogger {

  /** Category used when none is given. */
  public static final String DEFAULT_CATEGORY = "default";

  /** Subsystem used when the identifier of the host application cannot be resolved. */
  public static final String FALLBACK_SUBSYSTEM = ApplicationIdentifier.FALLBACK;

  private static final ErrorManager sinkErrors = new ErrorManager();

  private final String subsystem;
  private final String category;
  private final LogSink sink;

  /**
   * Returns the process-wide logger, created on first use with the default subsystem and
   * category.
   *
   * <p>Prefer passing a logger to the components that need one over calling this from within them.
   */
  public static SystemLogger main() {
    return SystemLoggerHolder.INSTANCE;
  }

  /** Creates a logger with the default subsystem and category. */
  public static SystemLogger create() {
    return builder().build();
  }

  /**
   * Creates a logger with the given subsystem and category.
   *
   * @param subsystem the identifier of the owner of the logs, or {@code null} for the identifier of
   *     the host application
   * @param category the area within the subsystem; {@code "default"} if empty
   */
  public static SystemLogger create(@Nullable String subsystem, @Nullable String category) {
    return builder().setSubsystem(subsystem).setCategory(category).build();
  }

  /** Creates a logger with the default subsystem and the given category. */
  public static SystemLogger forCategory(@Nullable String category) {
    return builder().setCategory(category).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  private SystemLogger(String subsystem, String category, LogSink sink) {
    this.subsystem = subsystem;
    this.category = category;
    this.sink = sink;
  }

  /** Returns a logger writing to the same subsystem and sink under another category. */
  public SystemLogger withCategory(@Nullable String category) {
    return new SystemLogger(subsystem, normalizeCategory(category), sink);
  }

  public String subsystem() {
    return subsystem;
  }

  public String category() {
    return category;
  }

  /** Logs an informational message about the regular operation of the application. */
  public void logInfo(@Nullable String message) {
    emit(Severity.INFO, message, false);
  }

  /** Logs a message useful while developing or troubleshooting. */
  public void logDebug(@Nullable String message) {
    emit(Severity.DEBUG, message, false);
  }

  /** Logs something unexpected that does not keep the application from working. */
  public void logWarning(@Nullable String message) {
    emit(Severity.WARNING, message, false);
  }

  /** Logs a serious issue the application can still run through. */
  public void logError(@Nullable String message) {
    emit(Severity.ERROR, message, false);
  }

  /**
   * Logs a fault: the application is in an unrecoverable state.
   *
   * <p>Written at {@link Severity#FAULT}, above {@link java.util.logging.Level#SEVERE}.
   */
  public void logCritical(@Nullable String message) {
    emit(Severity.FAULT, message, false);
  }

  /**
   * Logs a message holding sensitive data, such as user identifiers.
   *
   * <p>The entry is written at {@link Severity#DEFAULT} and marked redacted.
   */
  public void logPrivate(@Nullable String message) {
    emit(Severity.DEFAULT, message, true);
  }

  private void emit(Severity severity, @Nullable String message, boolean redacted) {
    try {
      sink.emit(severity, subsystem, category, String.valueOf(message), redacted);
    } catch (RuntimeException e) {
      sinkErrors.error(
          "Failed to write to " + sink.getClass().getName(), e, ErrorManager.WRITE_FAILURE);
    }
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("subsystem", subsystem)
        .add("category", category)
        .toString();
  }

  private static String normalizeCategory(@Nullable String category) {
    return isNullOrEmpty(category) ? DEFAULT_CATEGORY : category;
  }

  /** Builder for {@link SystemLogger}. */
  public static final class Builder {
    private @Nullable String subsystem;
    private @Nullable String category;
    private @Nullable LogSink sink;

    Builder() {}

    /** Sets the subsystem; {@code null} resolves the identifier of the host application. */
    @CanIgnoreReturnValue
    public Builder setSubsystem(@Nullable String subsystem) {
      this.subsystem = subsystem;
      return this;
    }

    /** Sets the category; {@code null} or empty means {@code "default"}. */
    @CanIgnoreReturnValue
    public Builder setCategory(@Nullable String category) {
      this.category = category;
      return this;
    }

    /** Sets the sink entries are written to; {@code null} means {@code java.util.logging}. */
    @CanIgnoreReturnValue
    public Builder setSink(@Nullable LogSink sink) {
      this.sink = sink;
      return this;
    }

    public SystemLogger build() {
      return new SystemLogger(
          subsystem == null ? ApplicationIdentifier.current() : subsystem,
          normalizeCategory(category),
          sink == null ? PlatformSinkHolder.INSTANCE : sink);
    }
  }
}
