package io.syncqueue.model;

import java.util.Objects;

/**
 * Resting states of a queue item.
 *
 * <p>Transitions: PENDING → PROCESSING (claim), PROCESSING → COMPLETED,
 * PROCESSING → PENDING (retry or reclaim), PROCESSING → DEAD_LETTER.
 * COMPLETED and DEAD_LETTER are terminal.
 */
public enum ItemStatus {
  PENDING("pending"),
  PROCESSING("processing"),
  COMPLETED("completed"),
  DEAD_LETTER("dead_letter");

  private final String dbValue;

  ItemStatus(String dbValue) {
    this.dbValue = dbValue;
  }

  public String dbValue() {
    return dbValue;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == DEAD_LETTER;
  }

  public static ItemStatus fromDbValue(String value) {
    Objects.requireNonNull(value, "value");
    for (ItemStatus status : values()) {
      if (status.dbValue.equals(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown status: " + value);
  }
}
