package com.systemlogger;

import com.systemlogger.sink.JulLogSink;
import com.systemlogger.sink.LogSink;

/** Holder of a singleton {@link JulLogSink} instance. */
final class PlatformSinkHolder {
  private PlatformSinkHolder() {}

  static final LogSink INSTANCE = JulLogSink.create();
}
