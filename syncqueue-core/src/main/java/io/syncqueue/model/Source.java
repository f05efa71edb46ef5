package io.syncqueue.model;

import java.util.Objects;

/**
 * External system that produced a queue item or owns a checkpoint.
 *
 * <p>The set is closed; adding a source means adding a constant here and
 * widening the {@code CHECK} constraints in the shipped DDL.
 */
public enum Source {
  TEAMWORK("teamwork"),
  MISSIVE("missive"),
  CRAFT("craft");

  private final String dbValue;

  Source(String dbValue) {
    this.dbValue = dbValue;
  }

  /** Value stored in the {@code source} column. */
  public String dbValue() {
    return dbValue;
  }

  /**
   * Resolves a stored column value.
   *
   * @throws IllegalArgumentException if the value is not a known source
   */
  public static Source fromDbValue(String value) {
    Objects.requireNonNull(value, "value");
    for (Source source : values()) {
      if (source.dbValue.equals(value)) {
        return source;
      }
    }
    throw new IllegalArgumentException("Unknown source: " + value);
  }
}
