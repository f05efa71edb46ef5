package io.syncqueue.jdbc;

import io.syncqueue.SyncQueue;
import io.syncqueue.jdbc.checkpoint.H2CheckpointStore;
import io.syncqueue.jdbc.store.H2QueueStore;
import io.syncqueue.model.ItemStatus;
import io.syncqueue.model.QueueHealth;
import io.syncqueue.model.RecentError;
import io.syncqueue.model.Source;
import io.syncqueue.model.SyncStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueueHealthMonitorTest {
  private static final Instant T0 = Instant.parse("2024-06-01T12:00:00Z");

  private MutableClock clock;
  private SyncQueue queue;

  @BeforeEach
  void setUp() throws SQLException {
    clock = new MutableClock(T0);
    queue = SyncQueue.builder()
        .connectionProvider(new DataSourceConnectionProvider(TestDatabases.h2()))
        .queueStore(new H2QueueStore())
        .checkpointStore(new H2CheckpointStore())
        .clock(clock)
        .build();
  }

  // ── queue health ───────────────────────────────────────────────

  @Test
  void emptyQueueReportsEverySource() {
    List<QueueHealth> health = queue.queueHealth();

    assertEquals(List.of(QueueHealth.empty(Source.TEAMWORK), QueueHealth.empty(Source.MISSIVE),
        QueueHealth.empty(Source.CRAFT)), health);
  }

  @Test
  void healthCountsBacklogAndStuckItems() {
    queue.enqueue(Source.TEAMWORK, "task.updated", "stuck", null);
    queue.dequeue("w1", 1);
    clock.advance(Duration.ofMinutes(10));
    long retrying = queue.enqueue(Source.TEAMWORK, "task.updated", "retrying", null);
    queue.markFailed(retrying, "timeout");
    long done = queue.enqueue(Source.MISSIVE, "conversation.updated", "done", null);
    queue.markCompleted(done, 1500L);
    clock.advance(Duration.ofMinutes(25));

    QueueHealth teamwork = queue.healthMonitor().queueHealth(Source.TEAMWORK);
    assertEquals(1, teamwork.pending());
    assertEquals(1, teamwork.processing());
    assertEquals(1, teamwork.failed());
    assertEquals(1, teamwork.stuck());
    assertEquals(Duration.ofMinutes(25), teamwork.oldestPendingAge());
    assertNull(teamwork.avgProcessingTimeMs());

    QueueHealth missive = queue.healthMonitor().queueHealth(Source.MISSIVE);
    assertEquals(0, missive.pending());
    assertEquals(1500.0, missive.avgProcessingTimeMs(), 0.001);
    assertEquals(T0.plus(Duration.ofMinutes(10)), missive.lastProcessedAt());
    assertNull(missive.oldestPendingAge());

    assertEquals(QueueHealth.empty(Source.CRAFT), queue.healthMonitor().queueHealth(Source.CRAFT));
  }

  @Test
  void stuckCountMatchesWhatResetWouldTouch() {
    long id = queue.enqueue(Source.CRAFT, "entry.updated", "renewed", null);
    queue.dequeue("w1", 1);
    clock.advance(Duration.ofMinutes(25));
    assertTrue(queue.renewLease(id, "w1"));
    clock.advance(Duration.ofMinutes(6));

    // claimed 31 minutes ago but the lease runs until minute 55
    assertEquals(0, queue.healthMonitor().queueHealth(Source.CRAFT).stuck());
    assertEquals(0, queue.resetStuckItems());

    clock.advance(Duration.ofMinutes(25));

    assertEquals(1, queue.healthMonitor().queueHealth(Source.CRAFT).stuck());
    assertEquals(1, queue.resetStuckItems());
    assertEquals(ItemStatus.PENDING, queue.find(id).orElseThrow().status());
  }

  // ── recent errors ──────────────────────────────────────────────

  @Test
  void recentErrorsUseWindowAndLimit() {
    long old = queue.enqueue(Source.CRAFT, "entry.updated", "old", null);
    queue.markFailed(old, "stale", false);
    clock.advance(Duration.ofHours(25));
    long dead = queue.enqueue(Source.CRAFT, "entry.updated", "dead", null);
    queue.markFailed(dead, "schema mismatch", false);
    clock.advance(Duration.ofMinutes(1));
    long retrying = queue.enqueue(Source.TEAMWORK, "task.updated", "retrying", null);
    queue.markFailed(retrying, "HTTP 503");

    List<RecentError> errors = queue.recentErrors();
    assertEquals(2, errors.size());
    assertEquals(retrying, errors.get(0).id());
    assertEquals("HTTP 503", errors.get(0).errorMessage());
    assertEquals(ItemStatus.PENDING, errors.get(0).status());
    assertEquals(dead, errors.get(1).id());
    assertEquals(ItemStatus.DEAD_LETTER, errors.get(1).status());

    assertEquals(1, queue.recentErrors(Duration.ofHours(24), 1).size());
    assertEquals(3, queue.recentErrors(Duration.ofDays(2), 10).size());
  }

  @Test
  void recentErrorsValidateArguments() {
    assertThrows(IllegalArgumentException.class, () -> queue.recentErrors(Duration.ofHours(1), 0));
    assertThrows(IllegalArgumentException.class, () -> queue.recentErrors(Duration.ofHours(-1), 10));
    assertThrows(NullPointerException.class, () -> queue.recentErrors(null, 10));
  }

  // ── sync status ────────────────────────────────────────────────

  @Test
  void syncStatusJoinsCheckpointsWithBacklog() {
    Instant lastEvent = T0.minus(Duration.ofHours(3));
    queue.setCheckpoint(Source.TEAMWORK, lastEvent, "page=4");
    queue.enqueue(Source.TEAMWORK, "task.updated", "1", null);
    queue.enqueue(Source.TEAMWORK, "task.updated", "2", null);
    clock.advance(Duration.ofMinutes(1));
    queue.touchCheckpoint(Source.CRAFT);

    List<SyncStatus> status = queue.syncStatus();

    assertEquals(3, status.size());
    SyncStatus teamwork = status.get(0);
    assertEquals(Source.TEAMWORK, teamwork.source());
    assertEquals(lastEvent, teamwork.lastEventTime());
    assertEquals(T0, teamwork.checkpointUpdatedAt());
    assertEquals(2, teamwork.pending());

    SyncStatus missive = status.get(1);
    assertNull(missive.lastEventTime());
    assertNull(missive.checkpointUpdatedAt());
    assertEquals(0, missive.pending());

    SyncStatus craft = status.get(2);
    assertEquals(Instant.EPOCH, craft.lastEventTime());
    assertEquals(T0.plus(Duration.ofMinutes(1)), craft.checkpointUpdatedAt());
  }

  // ── dead letters ───────────────────────────────────────────────

  @Test
  void deadLetterInspection() {
    long first = queue.enqueue(Source.MISSIVE, "conversation.updated", "1", null);
    long second = queue.enqueue(Source.MISSIVE, "conversation.updated", "2", null);
    queue.enqueue(Source.MISSIVE, "conversation.updated", "3", null);
    queue.markFailed(second, "bad", false);
    queue.markFailed(first, "bad", false);

    assertEquals(2, queue.countDeadLetters(null));
    assertEquals(2, queue.countDeadLetters(Source.MISSIVE));
    assertEquals(List.of(first), queue.deadLetters(Source.MISSIVE, 1).stream().map(i -> i.id()).toList());
    assertTrue(queue.deadLetters(Source.TEAMWORK, 10).isEmpty());
    assertThrows(IllegalArgumentException.class, () -> queue.deadLetters(null, 0));
  }
}
