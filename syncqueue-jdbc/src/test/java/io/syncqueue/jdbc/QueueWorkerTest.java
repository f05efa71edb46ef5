package io.syncqueue.jdbc;

import io.syncqueue.SyncQueue;
import io.syncqueue.jdbc.checkpoint.H2CheckpointStore;
import io.syncqueue.jdbc.store.H2QueueStore;
import io.syncqueue.model.ItemStatus;
import io.syncqueue.model.QueueItem;
import io.syncqueue.model.Source;
import io.syncqueue.worker.NonRetryableException;
import io.syncqueue.worker.QueueItemHandler;
import io.syncqueue.worker.QueueWorker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.sql.SQLException;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueueWorkerTest {

  private SyncQueue queue;

  @BeforeEach
  void setUp() throws SQLException {
    queue = SyncQueue.builder()
        .connectionProvider(new DataSourceConnectionProvider(TestDatabases.h2()))
        .queueStore(new H2QueueStore())
        .checkpointStore(new H2CheckpointStore())
        .build();
  }

  // ── outcomes ───────────────────────────────────────────────────

  @Test
  void successfulHandlingCompletesItem() {
    List<QueueItem> seen = new CopyOnWriteArrayList<>();
    long id = queue.enqueue(Source.TEAMWORK, "task.created", "1", "{\"id\":1}");
    QueueWorker worker = worker(seen::add);

    assertEquals(1, worker.runOnce());

    assertEquals(1, seen.size());
    assertEquals("{\"id\":1}", seen.get(0).payloadJson());
    QueueItem item = queue.find(id).orElseThrow();
    assertEquals(ItemStatus.COMPLETED, item.status());
    assertNotNull(item.processingTimeMs());
  }

  @Test
  void handlerExceptionSchedulesRetry() {
    long id = queue.enqueue(Source.TEAMWORK, "task.created", "1", null);
    QueueWorker worker = worker(item -> {
      throw new IOException("connect timed out");
    });

    worker.runOnce();

    QueueItem item = queue.find(id).orElseThrow();
    assertEquals(ItemStatus.PENDING, item.status());
    assertEquals(1, item.retryCount());
    assertEquals("IOException: connect timed out", item.errorMessage());
  }

  @Test
  void nonRetryableExceptionDeadLetters() {
    long id = queue.enqueue(Source.CRAFT, "entry.created", "1", "not json");
    QueueWorker worker = worker(item -> {
      throw new NonRetryableException("malformed payload");
    });

    worker.runOnce();

    QueueItem item = queue.find(id).orElseThrow();
    assertEquals(ItemStatus.DEAD_LETTER, item.status());
    assertEquals(0, item.retryCount());
    assertEquals("NonRetryableException: malformed payload", item.errorMessage());
  }

  @Test
  void errorFromHandlerIsRecordedAndBatchContinues() {
    long bad = queue.enqueue(Source.TEAMWORK, "task.created", "bad", null);
    long good = queue.enqueue(Source.TEAMWORK, "task.created", "good", null);
    QueueWorker worker = worker(item -> {
      if (item.id() == bad) {
        throw new AssertionError("poisoned");
      }
    });

    assertEquals(2, worker.runOnce());

    QueueItem failed = queue.find(bad).orElseThrow();
    assertEquals(ItemStatus.PENDING, failed.status());
    assertEquals(1, failed.retryCount());
    assertEquals("AssertionError: poisoned", failed.errorMessage());
    assertEquals(ItemStatus.COMPLETED, queue.find(good).orElseThrow().status());
  }

  @Test
  void exceptionWithoutMessageRecordsClassName() {
    long id = queue.enqueue(Source.CRAFT, "entry.created", "1", null);
    QueueWorker worker = worker(item -> {
      throw new IllegalStateException();
    });

    worker.runOnce();

    assertEquals("java.lang.IllegalStateException", queue.find(id).orElseThrow().errorMessage());
  }

  @Test
  void runOnceHandlesOneBatch() {
    for (int i = 0; i < 5; i++) {
      queue.enqueue(Source.MISSIVE, "conversation.updated", "m" + i, null);
    }
    List<QueueItem> seen = new CopyOnWriteArrayList<>();
    QueueWorker worker = QueueWorker.builder()
        .syncQueue(queue)
        .handler(seen::add)
        .workerIdPrefix("test")
        .batchSize(3)
        .build();

    assertEquals(3, worker.runOnce());
    assertEquals(2, worker.runOnce());
    assertEquals(0, worker.runOnce());
    assertTrue(seen.stream().allMatch(item -> "test-1".equals(item.workerId())));
  }

  @Test
  void sourceFilterIsApplied() {
    queue.enqueue(Source.TEAMWORK, "task.created", "t", null);
    long craft = queue.enqueue(Source.CRAFT, "entry.created", "c", null);
    List<QueueItem> seen = new CopyOnWriteArrayList<>();
    QueueWorker worker = QueueWorker.builder()
        .syncQueue(queue)
        .handler(seen::add)
        .source(Source.CRAFT)
        .build();

    worker.runOnce();

    assertEquals(1, seen.size());
    assertEquals(craft, seen.get(0).id());
  }

  @Test
  void itemNoLongerHeldIsSkipped() {
    long first = queue.enqueue(Source.TEAMWORK, "task.updated", "first", null);
    long second = queue.enqueue(Source.TEAMWORK, "task.updated", "second", null);
    List<Long> seen = new CopyOnWriteArrayList<>();
    QueueWorker worker = QueueWorker.builder()
        .syncQueue(queue)
        .handler(item -> {
          seen.add(item.id());
          if (item.id() == first) {
            queue.markCompleted(second, 0L);
          }
        })
        .batchSize(2)
        .build();

    assertEquals(1, worker.runOnce());
    assertEquals(List.of(first), seen);
  }

  // ── lifecycle ──────────────────────────────────────────────────

  @Test
  void startedWorkerDrainsQueue() throws Exception {
    int items = 12;
    CountDownLatch latch = new CountDownLatch(items);
    Set<String> workerIds = ConcurrentHashMap.newKeySet();
    for (int i = 0; i < items; i++) {
      queue.enqueue(Source.values()[i % 3], "item.updated", "e" + i, null);
    }
    try (QueueWorker worker = QueueWorker.builder()
        .syncQueue(queue)
        .handler(item -> {
          workerIds.add(item.workerId());
          latch.countDown();
        })
        .workerIdPrefix("pool")
        .batchSize(2)
        .intervalMs(10)
        .concurrency(3)
        .build()) {
      worker.start();
      worker.start();
      assertTrue(latch.await(10, TimeUnit.SECONDS));
    }
    assertTrue(Set.of("pool-1", "pool-2", "pool-3").containsAll(workerIds));
    assertEquals(0, queue.healthMonitor().queueHealth().stream().mapToLong(h -> h.pending()).sum());
  }

  @Test
  void closedWorkerCannotRestart() {
    QueueWorker worker = worker(item -> { });
    worker.close();

    assertThrows(IllegalStateException.class, worker::start);
    assertEquals(0, worker.runOnce());
  }

  @Test
  void builderValidates() {
    assertThrows(NullPointerException.class, () -> QueueWorker.builder().handler(item -> { }).build());
    assertThrows(NullPointerException.class, () -> QueueWorker.builder().syncQueue(queue).build());
    assertThrows(IllegalArgumentException.class,
        () -> QueueWorker.builder().syncQueue(queue).handler(item -> { }).batchSize(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> QueueWorker.builder().syncQueue(queue).handler(item -> { }).intervalMs(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> QueueWorker.builder().syncQueue(queue).handler(item -> { }).concurrency(0).build());
  }

  private QueueWorker worker(QueueItemHandler handler) {
    return QueueWorker.builder().syncQueue(queue).handler(handler).build();
  }
}
