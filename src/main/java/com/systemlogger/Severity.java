package com.systemlogger;

import java.util.logging.Level;

/**
 * Severity attached to every entry emitted by a {@link SystemLogger}.
 *
 * <p>Each severity maps to the nearest {@link Level} of {@code java.util.logging}. {@link #FAULT}
 * has no standard counterpart and maps to {@link #FAULT_LEVEL}, which sits above {@link
 * Level#SEVERE}.
 */
public enum Severity {
  DEBUG(Level.FINE),
  INFO(Level.INFO),
  /** Severity of entries that carry no explicit level, such as private entries. */
  DEFAULT(Level.INFO),
  WARNING(Level.WARNING),
  ERROR(Level.SEVERE),
  FAULT(FaultLevel.INSTANCE);

  /** Level used for {@link #FAULT} entries. */
  public static final Level FAULT_LEVEL = FaultLevel.INSTANCE;

  private final Level level;

  Severity(Level level) {
    this.level = level;
  }

  /** Returns the {@code java.util.logging} level this severity is written at. */
  public Level level() {
    return level;
  }

  private static final class FaultLevel extends Level {
    private static final long serialVersionUID = 1L;

    static final Level INSTANCE = new FaultLevel();

    private FaultLevel() {
      super("FAULT", Level.SEVERE.intValue() + 100);
    }
  }
}
