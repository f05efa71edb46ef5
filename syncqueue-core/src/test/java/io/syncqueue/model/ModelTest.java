package io.syncqueue.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModelTest {
  private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

  @Test
  void sourceRoundTripsColumnValue() {
    for (Source source : Source.values()) {
      assertEquals(source, Source.fromDbValue(source.dbValue()));
    }
    assertEquals("teamwork", Source.TEAMWORK.dbValue());
    assertThrows(IllegalArgumentException.class, () -> Source.fromDbValue("jira"));
    assertThrows(IllegalArgumentException.class, () -> Source.fromDbValue("TEAMWORK"));
  }

  @Test
  void statusRoundTripsColumnValue() {
    assertEquals(ItemStatus.DEAD_LETTER, ItemStatus.fromDbValue("dead_letter"));
    assertThrows(IllegalArgumentException.class, () -> ItemStatus.fromDbValue("failed"));
    assertTrue(ItemStatus.COMPLETED.isTerminal());
    assertTrue(ItemStatus.DEAD_LETTER.isTerminal());
    assertFalse(ItemStatus.PENDING.isTerminal());
    assertFalse(ItemStatus.PROCESSING.isTerminal());
  }

  @Test
  void leaseRequiresAllParts() {
    assertThrows(NullPointerException.class, () -> new Lease(null, "token", NOW));
    assertThrows(NullPointerException.class, () -> new Lease("w1", null, NOW));
    assertThrows(NullPointerException.class, () -> new Lease("w1", "token", null));
  }

  @Test
  void emptyHealth() {
    QueueHealth health = QueueHealth.empty(Source.CRAFT);

    assertEquals(0, health.pending());
    assertNull(health.oldestPendingAge());
  }
}
