package io.syncqueue.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.syncqueue.SyncQueue;
import io.syncqueue.jdbc.checkpoint.JdbcCheckpointStores;
import io.syncqueue.jdbc.purge.JdbcItemPurgers;
import io.syncqueue.jdbc.store.JdbcQueueStores;
import io.syncqueue.model.ItemStatus;
import io.syncqueue.model.QueueHealth;
import io.syncqueue.model.Source;
import io.syncqueue.worker.QueueWorker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class HikariCPIntegrationTest {
  private HikariDataSource hikariDs;
  private SyncQueue queue;

  @BeforeEach
  void setup() throws Exception {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:hikari_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
    config.setMaximumPoolSize(5);
    config.setMinimumIdle(1);
    config.setPoolName("syncqueue-test-pool");

    hikariDs = new HikariDataSource(config);
    TestDatabases.createSchema(hikariDs, "h2");
    queue = SyncQueue.builder()
        .connectionProvider(new DataSourceConnectionProvider(hikariDs))
        .queueStore(JdbcQueueStores.detect(hikariDs))
        .checkpointStore(JdbcCheckpointStores.detect(hikariDs))
        .purger(JdbcItemPurgers.detect(hikariDs))
        .build();
  }

  @AfterEach
  void tearDown() {
    if (hikariDs != null && !hikariDs.isClosed()) {
      hikariDs.close();
    }
  }

  @Test
  void workersDrainQueueThroughPool() throws Exception {
    int total = 30;
    CountDownLatch latch = new CountDownLatch(total);
    Set<Long> handled = ConcurrentHashMap.newKeySet();
    AtomicInteger duplicates = new AtomicInteger();
    List<Long> ids = new ArrayList<>();
    for (int i = 0; i < total; i++) {
      ids.add(queue.enqueue(Source.values()[i % 3], "item.updated", "e" + i, "{\"n\":" + i + "}"));
    }

    try (QueueWorker worker = QueueWorker.builder()
        .syncQueue(queue)
        .handler(item -> {
          if (!handled.add(item.id())) {
            duplicates.incrementAndGet();
          }
          latch.countDown();
        })
        .batchSize(4)
        .intervalMs(10)
        .concurrency(3)
        .build()) {
      worker.start();
      assertTrue(latch.await(15, TimeUnit.SECONDS), "All items should be handled");
    }

    assertEquals(0, duplicates.get());
    assertEquals(total, handled.size());
    long completed = ids.stream()
        .filter(id -> queue.find(id).orElseThrow().status() == ItemStatus.COMPLETED)
        .count();
    // the last item may still be between handler return and completion when the worker closes
    assertTrue(completed >= total - 3, "completed=" + completed);
  }

  @Test
  void facadeOperationsReturnConnectionsToPool() {
    for (int i = 0; i < 50; i++) {
      long id = queue.enqueue(Source.CRAFT, "entry.updated", "c" + i, null);
      queue.dequeue("pool-worker", 1);
      queue.markCompleted(id, 1L);
      queue.setCheckpoint(Source.CRAFT, Instant.now(), "page=" + i);
    }
    List<QueueHealth> health = queue.queueHealth();

    assertEquals(0, health.get(2).pending());
    assertEquals(0, hikariDs.getHikariPoolMXBean().getActiveConnections());
    assertEquals("page=49", queue.getCheckpoint(Source.CRAFT).orElseThrow().lastCursor());
  }
}
