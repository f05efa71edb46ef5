package io.syncqueue.jdbc;

import io.syncqueue.QueueEvent;
import io.syncqueue.jdbc.purge.H2ItemPurger;
import io.syncqueue.jdbc.store.H2QueueStore;
import io.syncqueue.model.Source;
import io.syncqueue.retry.BackoffSchedule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcItemPurgerTest {
  private static final Instant T0 = Instant.parse("2024-06-01T12:00:00Z");

  private Connection conn;
  private H2QueueStore store;
  private H2ItemPurger purger;

  @BeforeEach
  void setUp() throws SQLException {
    conn = TestDatabases.h2().getConnection();
    store = new H2QueueStore();
    purger = new H2ItemPurger();
  }

  @AfterEach
  void tearDown() throws SQLException {
    conn.close();
  }

  @Test
  void purgesCompletedItemsBeforeCutoff() {
    long old = completed("old", T0);
    long recent = completed("recent", T0.plus(Duration.ofDays(2)));

    assertEquals(1, purger.purge(conn, T0.plus(Duration.ofDays(1)), 100));

    assertTrue(store.findById(conn, old).isEmpty());
    assertTrue(store.findById(conn, recent).isPresent());
  }

  @Test
  void cutoffIsExclusive() {
    completed("edge", T0);
    assertEquals(0, purger.purge(conn, T0, 100));
  }

  @Test
  void keepsNonCompletedItems() {
    long done = store.insert(conn, event("done"), T0);
    long processing = store.insert(conn, event("processing"), T0);
    store.claim(conn, "w1", null, T0, T0.plusSeconds(60), 2);
    store.markCompleted(conn, done, 1L, T0);
    long retrying = store.insert(conn, event("retrying"), T0);
    store.markFailed(conn, retrying, "timeout", true, BackoffSchedule.DEFAULT, T0);
    long dead = store.insert(conn, event("dead"), T0);
    store.markFailed(conn, dead, "bad", false, BackoffSchedule.DEFAULT, T0);

    assertEquals(1, purger.purge(conn, T0.plus(Duration.ofDays(30)), 100));

    assertTrue(store.findById(conn, done).isEmpty());
    assertTrue(store.findById(conn, processing).isPresent());
    assertTrue(store.findById(conn, retrying).isPresent());
    assertTrue(store.findById(conn, dead).isPresent());
  }

  @Test
  void purgesOldestFirstUpToLimit() {
    long first = completed("a", T0);
    long second = completed("b", T0.plusSeconds(1));
    long third = completed("c", T0.plusSeconds(2));

    assertEquals(2, purger.purge(conn, T0.plus(Duration.ofDays(1)), 2));

    assertTrue(store.findById(conn, first).isEmpty());
    assertTrue(store.findById(conn, second).isEmpty());
    assertTrue(store.findById(conn, third).isPresent());
  }

  @Test
  void returnsZeroWhenNothingToPurge() {
    assertEquals(0, purger.purge(conn, T0, 10));
  }

  private long completed(String externalId, Instant processedAt) {
    long id = store.insert(conn, event(externalId), T0);
    store.markCompleted(conn, id, 1L, processedAt);
    return id;
  }

  private static QueueEvent event(String externalId) {
    return QueueEvent.of(Source.CRAFT, "entry.updated", externalId, null);
  }
}
