package com.systemlogger;

/** Holder of the process-wide {@link SystemLogger} returned by {@link SystemLogger#main()}. */
final class SystemLoggerHolder {
  private SystemLoggerHolder() {}

  static final SystemLogger INSTANCE = SystemLogger.create();
}
