package io.syncqueue;

import io.syncqueue.model.Source;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class QueueEventTest {

  @Test
  void defaults() {
    QueueEvent event = QueueEvent.builder(Source.TEAMWORK, "task.created", "12345").build();

    assertEquals(Source.TEAMWORK, event.source());
    assertEquals("task.created", event.eventType());
    assertEquals("12345", event.externalId());
    assertNull(event.payloadJson());
    assertEquals(QueueEvent.DEFAULT_MAX_RETRIES, event.maxRetries());
  }

  @Test
  void ofKeepsPayloadVerbatim() {
    QueueEvent event = QueueEvent.of(Source.MISSIVE, "conversation.updated", "c-1", "{ \"a\" : [1, 2] }");
    assertEquals("{ \"a\" : [1, 2] }", event.payloadJson());
  }

  @Test
  void zeroRetriesAllowed() {
    assertEquals(0, QueueEvent.builder(Source.CRAFT, "entry.deleted", "e").maxRetries(0).build().maxRetries());
  }

  @Test
  void rejectsInvalidFields() {
    assertThrows(NullPointerException.class, () -> QueueEvent.of(null, "t", "1", null));
    assertThrows(NullPointerException.class, () -> QueueEvent.of(Source.CRAFT, null, "1", null));
    assertThrows(NullPointerException.class, () -> QueueEvent.of(Source.CRAFT, "t", null, null));
    assertThrows(IllegalArgumentException.class, () -> QueueEvent.of(Source.CRAFT, "", "1", null));
    assertThrows(IllegalArgumentException.class, () -> QueueEvent.of(Source.CRAFT, "t", "", null));
    assertThrows(IllegalArgumentException.class,
        () -> QueueEvent.of(Source.CRAFT, "t".repeat(QueueEvent.MAX_EVENT_TYPE_LENGTH + 1), "1", null));
    assertThrows(IllegalArgumentException.class,
        () -> QueueEvent.of(Source.CRAFT, "t", "1".repeat(QueueEvent.MAX_EXTERNAL_ID_LENGTH + 1), null));
    assertThrows(IllegalArgumentException.class,
        () -> QueueEvent.builder(Source.CRAFT, "t", "1").maxRetries(-1).build());
  }
}
