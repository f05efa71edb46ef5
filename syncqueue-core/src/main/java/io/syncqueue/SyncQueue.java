package io.syncqueue;

import io.syncqueue.dead.DeadLetterInspector;
import io.syncqueue.health.QueueHealthMonitor;
import io.syncqueue.model.Checkpoint;
import io.syncqueue.model.ItemStatus;
import io.syncqueue.model.QueueHealth;
import io.syncqueue.model.QueueItem;
import io.syncqueue.model.RecentError;
import io.syncqueue.model.Source;
import io.syncqueue.model.SyncStatus;
import io.syncqueue.retry.BackoffSchedule;
import io.syncqueue.spi.CheckpointStore;
import io.syncqueue.spi.ConnectionProvider;
import io.syncqueue.spi.ItemPurger;
import io.syncqueue.spi.MetricsExporter;
import io.syncqueue.spi.QueueStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable work queue and checkpoint store shared by any number of worker
 * processes.
 *
 * <p>Each call borrows a connection from the {@link ConnectionProvider}, runs
 * one auto-committed statement and returns the connection. {@link #dequeue}
 * is the exception: its claim runs in its own short transaction so that row
 * locks are held only for the claim itself. The backing store is the only
 * coordination point; no state is kept in this object between calls.
 *
 * <p>Store failures surface as {@link QueueStoreException}.
 *
 * <pre>{@code
 * SyncQueue queue = SyncQueue.builder()
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .queueStore(JdbcQueueStores.detect(dataSource))
 *     .checkpointStore(JdbcCheckpointStores.detect(dataSource))
 *     .build();
 *
 * long id = queue.enqueue(Source.TEAMWORK, "task.created", "12345", "{\"id\":12345}");
 * for (QueueItem item : queue.dequeue("worker-1", 10)) {
 *   ...
 *   queue.markCompleted(item.id(), elapsedMs);
 * }
 * }</pre>
 *
 * <p>This class is thread-safe.
 *
 * @see SyncQueue.Builder
 */
public final class SyncQueue {
  private static final Logger logger = Logger.getLogger(SyncQueue.class.getName());

  static final int MAX_ERROR_MESSAGE_LENGTH = 4000;
  static final int MAX_WORKER_ID_LENGTH = 100;

  public static final Duration DEFAULT_LEASE_DURATION = Duration.ofMinutes(30);
  public static final Duration DEFAULT_STUCK_THRESHOLD = Duration.ofMinutes(30);
  public static final Duration DEFAULT_RETENTION = Duration.ofDays(7);
  public static final Duration DEFAULT_ERROR_WINDOW = Duration.ofHours(24);
  public static final int DEFAULT_ERROR_LIMIT = 100;
  public static final int DEFAULT_PURGE_BATCH_SIZE = 500;

  private final ConnectionProvider connectionProvider;
  private final QueueStore queueStore;
  private final CheckpointStore checkpointStore;
  private final ItemPurger purger;
  private final BackoffSchedule backoff;
  private final Clock clock;
  private final Duration leaseDuration;
  private final Duration stuckThreshold;
  private final MetricsExporter metrics;
  private final QueueHealthMonitor healthMonitor;
  private final DeadLetterInspector deadLetterInspector;

  private SyncQueue(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.queueStore = Objects.requireNonNull(builder.queueStore, "queueStore");
    this.checkpointStore = Objects.requireNonNull(builder.checkpointStore, "checkpointStore");
    this.purger = builder.purger;
    this.backoff = builder.backoff != null ? builder.backoff : BackoffSchedule.DEFAULT;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.leaseDuration = builder.leaseDuration != null ? builder.leaseDuration : DEFAULT_LEASE_DURATION;
    this.stuckThreshold = builder.stuckThreshold != null ? builder.stuckThreshold : DEFAULT_STUCK_THRESHOLD;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;

    if (leaseDuration.isNegative() || leaseDuration.isZero()) {
      throw new IllegalArgumentException("leaseDuration must be > 0");
    }
    if (stuckThreshold.compareTo(leaseDuration) < 0) {
      throw new IllegalArgumentException("stuckThreshold must be >= leaseDuration");
    }

    this.healthMonitor = new QueueHealthMonitor(
        connectionProvider, queueStore, checkpointStore, clock, stuckThreshold, metrics);
    this.deadLetterInspector = new DeadLetterInspector(connectionProvider, queueStore);
  }

  public static Builder builder() {
    return new Builder();
  }

  // ── producer side ───────────────────────────────────────────────────

  /**
   * Enqueues a PENDING item with the default retry budget.
   *
   * @param payloadJson opaque JSON payload, may be {@code null}
   * @return the new item id
   */
  public long enqueue(Source source, String eventType, String externalId, String payloadJson) {
    return enqueue(QueueEvent.of(source, eventType, externalId, payloadJson));
  }

  /**
   * Enqueues a PENDING item. Duplicates of an existing item are accepted; see
   * {@link #enqueueIfAbsent(QueueEvent)} for the deduplicating variant.
   *
   * @return the new item id
   */
  public long enqueue(QueueEvent event) {
    Objects.requireNonNull(event, "event");
    long id = inConnection("enqueue " + event,
        conn -> queueStore.insert(conn, event, clock.instant()));
    metrics.incrementEnqueued(event.source());
    logger.log(Level.FINE, "Enqueued item {0} {1}", new Object[]{id, event});
    return id;
  }

  /**
   * Enqueues several items in one transaction. Either all are inserted or none.
   *
   * @return the new ids, in input order
   */
  public List<Long> enqueueAll(List<QueueEvent> events) {
    Objects.requireNonNull(events, "events");
    if (events.isEmpty()) {
      return List.of();
    }
    List<Long> ids;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        ids = queueStore.insertBatch(conn, events, clock.instant());
        conn.commit();
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    } catch (SQLException e) {
      throw new QueueStoreException("Failed to enqueue batch of " + events.size(), e);
    }
    for (QueueEvent event : events) {
      metrics.incrementEnqueued(event.source());
    }
    return ids;
  }

  /**
   * Enqueues the event unless a PENDING or PROCESSING item with the same
   * source, event type and external id exists. Completed and dead-lettered
   * items do not block a new insert.
   *
   * @return the new item id, or empty if an active duplicate was found
   */
  public OptionalLong enqueueIfAbsent(QueueEvent event) {
    Objects.requireNonNull(event, "event");
    OptionalLong id = inConnection("enqueue " + event,
        conn -> queueStore.insertIfAbsent(conn, event, clock.instant()));
    if (id.isPresent()) {
      metrics.incrementEnqueued(event.source());
    } else {
      logger.log(Level.FINE, "Skipped duplicate {0}", event);
    }
    return id;
  }

  public Optional<QueueItem> find(long id) {
    return inConnection("find item " + id, conn -> queueStore.findById(conn, id));
  }

  // ── worker side ─────────────────────────────────────────────────────

  /**
   * Claims up to {@code maxItems} eligible items from any source.
   *
   * @see #dequeue(String, int, Source)
   */
  public List<QueueItem> dequeue(String workerId, int maxItems) {
    return dequeue(workerId, maxItems, null);
  }

  /**
   * Claims up to {@code maxItems} eligible items, oldest first.
   *
   * <p>Eligible items are PENDING with no {@code next_retry_at} or one that has
   * passed. Claimed items are PROCESSING, stamped with {@code workerId} and a
   * lease of {@link Builder#leaseDuration}. Rows locked by a concurrent claim
   * are skipped, so concurrent callers never receive the same item and never
   * wait on each other.
   *
   * @param source optional source filter ({@code null} for all)
   * @return the claimed items; empty when nothing is eligible
   */
  public List<QueueItem> dequeue(String workerId, int maxItems, Source source) {
    validateWorkerId(workerId);
    if (maxItems <= 0) {
      throw new IllegalArgumentException("maxItems must be > 0");
    }
    Instant now = clock.instant();
    Instant leaseExpiresAt = now.plus(leaseDuration);
    List<QueueItem> claimed;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        claimed = queueStore.claim(conn, workerId, source, now, leaseExpiresAt, maxItems);
        conn.commit();
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    } catch (SQLException e) {
      throw new QueueStoreException("Failed to dequeue for worker " + workerId, e);
    }
    if (!claimed.isEmpty()) {
      metrics.incrementClaimed(claimed.size());
      logger.log(Level.FINE, "Worker {0} claimed {1} items", new Object[]{workerId, claimed.size()});
    }
    return claimed;
  }

  /**
   * Extends the lease of an item this worker still holds to now plus the lease
   * duration.
   *
   * @return {@code false} if the item is no longer PROCESSING under {@code workerId}
   */
  public boolean renewLease(long id, String workerId) {
    validateWorkerId(workerId);
    Instant now = clock.instant();
    return inConnection("renew lease of item " + id,
        conn -> queueStore.renewLease(conn, id, workerId, now, now.plus(leaseDuration))) > 0;
  }

  /**
   * Marks an item COMPLETED without a processing time.
   *
   * @see #markCompleted(long, Long)
   */
  public boolean markCompleted(long id) {
    return markCompleted(id, null);
  }

  /**
   * Marks an item COMPLETED. Calling it again on a completed item overwrites
   * the completion fields; a DEAD_LETTER item is left untouched.
   *
   * @param processingTimeMs processing time in milliseconds, may be {@code null}
   * @return {@code true} if a row was updated
   */
  public boolean markCompleted(long id, Long processingTimeMs) {
    if (processingTimeMs != null && processingTimeMs < 0) {
      throw new IllegalArgumentException("processingTimeMs must be >= 0");
    }
    int updated = inConnection("mark item " + id + " completed",
        conn -> queueStore.markCompleted(conn, id, processingTimeMs, clock.instant()));
    if (updated > 0) {
      metrics.incrementCompleted();
      if (processingTimeMs != null) {
        metrics.recordProcessingTimeMs(processingTimeMs);
      }
      logger.log(Level.FINE, "Completed item {0}", id);
    }
    return updated > 0;
  }

  /**
   * Records a retryable failure.
   *
   * @see #markFailed(long, String, boolean)
   */
  public Optional<ItemStatus> markFailed(long id, String errorMessage) {
    return markFailed(id, errorMessage, true);
  }

  /**
   * Records a failed attempt.
   *
   * <p>If {@code retry} is set and the item's retry count is below its max
   * retries, the item goes back to PENDING with the count incremented and
   * becomes eligible again after the backoff for its previous count. Otherwise
   * it is dead-lettered. Completed and dead-lettered items are left untouched.
   *
   * @param errorMessage failure detail, truncated to 4000 characters; may be {@code null}
   * @return PENDING or DEAD_LETTER, or empty if the item was not found or already terminal
   */
  public Optional<ItemStatus> markFailed(long id, String errorMessage, boolean retry) {
    String error = truncate(errorMessage);
    Optional<ItemStatus> outcome = inConnection("mark item " + id + " failed",
        conn -> queueStore.markFailed(conn, id, error, retry, backoff, clock.instant()));
    if (outcome.isEmpty()) {
      logger.log(Level.FINE, "Item {0} not failed: missing or already terminal", id);
    } else if (outcome.get().isTerminal()) {
      metrics.incrementDeadLettered();
      logger.log(Level.WARNING, "Dead-lettered item {0}: {1}", new Object[]{id, error});
    } else {
      metrics.incrementRetried();
      logger.log(Level.FINE, "Scheduled retry of item {0}: {1}", new Object[]{id, error});
    }
    return outcome;
  }

  // ── maintenance ─────────────────────────────────────────────────────

  /** Resets stuck items using the configured stuck threshold. */
  public int resetStuckItems() {
    return resetStuckItems(stuckThreshold);
  }

  /**
   * Returns PROCESSING items claimed more than {@code threshold} ago to PENDING,
   * unless their lease is still live. Retry counts are not changed.
   *
   * @return the number of items reset
   */
  public int resetStuckItems(Duration threshold) {
    Objects.requireNonNull(threshold, "threshold");
    if (threshold.isNegative()) {
      throw new IllegalArgumentException("threshold must be >= 0");
    }
    Instant now = clock.instant();
    int reset = inConnection("reset stuck items",
        conn -> queueStore.resetStuck(conn, now.minus(threshold), now));
    if (reset > 0) {
      metrics.incrementReclaimed(reset);
      logger.log(Level.WARNING, "Reset {0} items stuck in processing for more than {1}",
          new Object[]{reset, threshold});
    }
    return reset;
  }

  /**
   * Returns PROCESSING items whose lease has expired to PENDING. Retry counts
   * are not changed.
   *
   * @return the number of items reclaimed
   */
  public int reclaimExpiredLeases() {
    int reclaimed = inConnection("reclaim expired leases",
        conn -> queueStore.reclaimExpiredLeases(conn, clock.instant()));
    if (reclaimed > 0) {
      metrics.incrementReclaimed(reclaimed);
      logger.log(Level.WARNING, "Reclaimed {0} items with expired leases", reclaimed);
    }
    return reclaimed;
  }

  /** Deletes completed items older than the default retention of 7 days. */
  public int cleanupOldItems() {
    return cleanupOldItems(DEFAULT_RETENTION);
  }

  public int cleanupOldItems(Duration retention) {
    return cleanupOldItems(retention, DEFAULT_PURGE_BATCH_SIZE);
  }

  /**
   * Deletes COMPLETED items processed more than {@code retention} ago, in
   * batches of {@code batchSize} until a batch comes back short. Each batch
   * runs on its own connection. Dead-lettered and in-flight items are kept.
   *
   * @return the total number of items deleted
   * @throws IllegalStateException if no {@link ItemPurger} was configured
   */
  public int cleanupOldItems(Duration retention, int batchSize) {
    Objects.requireNonNull(retention, "retention");
    if (retention.isNegative()) {
      throw new IllegalArgumentException("retention must be >= 0");
    }
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (purger == null) {
      throw new IllegalStateException("No ItemPurger configured");
    }
    Instant cutoff = clock.instant().minus(retention);
    int total = 0;
    int deleted;
    do {
      deleted = inConnection("purge completed items", conn -> purger.purge(conn, cutoff, batchSize));
      total += deleted;
    } while (deleted >= batchSize);
    if (total > 0) {
      metrics.incrementPurged(total);
      logger.log(Level.INFO, "Purged {0} completed items processed before {1}",
          new Object[]{total, cutoff});
    }
    return total;
  }

  // ── checkpoints ─────────────────────────────────────────────────────

  public Optional<Checkpoint> getCheckpoint(Source source) {
    Objects.requireNonNull(source, "source");
    return inConnection("read checkpoint " + source.dbValue(),
        conn -> checkpointStore.find(conn, source));
  }

  /**
   * Stores the resume position for {@code source}, replacing any previous one.
   *
   * @param lastCursor opaque pagination token, may be {@code null}
   */
  public void setCheckpoint(Source source, Instant lastEventTime, String lastCursor) {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(lastEventTime, "lastEventTime");
    inConnection("write checkpoint " + source.dbValue(), conn -> {
      checkpointStore.upsert(conn, source, lastEventTime, lastCursor, clock.instant());
      return null;
    });
  }

  /**
   * Records that a scan for {@code source} ran without moving its position.
   * A missing checkpoint is created at the Unix epoch.
   */
  public void touchCheckpoint(Source source) {
    Objects.requireNonNull(source, "source");
    inConnection("touch checkpoint " + source.dbValue(), conn -> {
      checkpointStore.touch(conn, source, clock.instant());
      return null;
    });
  }

  public List<Checkpoint> listCheckpoints() {
    return inConnection("list checkpoints", checkpointStore::findAll);
  }

  // ── read-only views ─────────────────────────────────────────────────

  /** @see QueueHealthMonitor#queueHealth() */
  public List<QueueHealth> queueHealth() {
    return healthMonitor.queueHealth();
  }

  /** Recent errors in the last 24 hours, at most 100. */
  public List<RecentError> recentErrors() {
    return healthMonitor.recentErrors(DEFAULT_ERROR_WINDOW, DEFAULT_ERROR_LIMIT);
  }

  /** @see QueueHealthMonitor#recentErrors(Duration, int) */
  public List<RecentError> recentErrors(Duration window, int limit) {
    return healthMonitor.recentErrors(window, limit);
  }

  /** @see QueueHealthMonitor#syncStatus() */
  public List<SyncStatus> syncStatus() {
    return healthMonitor.syncStatus();
  }

  /** @see DeadLetterInspector#query(Source, int) */
  public List<QueueItem> deadLetters(Source source, int limit) {
    return deadLetterInspector.query(source, limit);
  }

  /** @see DeadLetterInspector#count(Source) */
  public long countDeadLetters(Source source) {
    return deadLetterInspector.count(source);
  }

  public QueueHealthMonitor healthMonitor() {
    return healthMonitor;
  }

  public DeadLetterInspector deadLetterInspector() {
    return deadLetterInspector;
  }

  public Duration leaseDuration() {
    return leaseDuration;
  }

  public Duration stuckThreshold() {
    return stuckThreshold;
  }

  private <T> T inConnection(String action, Function<Connection, T> work) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return work.apply(conn);
    } catch (SQLException e) {
      throw new QueueStoreException("Failed to " + action, e);
    }
  }

  private static void validateWorkerId(String workerId) {
    Objects.requireNonNull(workerId, "workerId");
    if (workerId.isEmpty() || workerId.length() > MAX_WORKER_ID_LENGTH) {
      throw new IllegalArgumentException("workerId must be 1.." + MAX_WORKER_ID_LENGTH + " characters");
    }
  }

  static String truncate(String errorMessage) {
    if (errorMessage == null || errorMessage.length() <= MAX_ERROR_MESSAGE_LENGTH) {
      return errorMessage;
    }
    return errorMessage.substring(0, MAX_ERROR_MESSAGE_LENGTH);
  }

  /** Builder for {@link SyncQueue}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private QueueStore queueStore;
    private CheckpointStore checkpointStore;
    private ItemPurger purger;
    private BackoffSchedule backoff;
    private Clock clock;
    private Duration leaseDuration;
    private Duration stuckThreshold;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * <b>Required.</b> Source of JDBC connections; each operation closes the
     * connection it borrows.
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder queueStore(QueueStore queueStore) {
      this.queueStore = queueStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder checkpointStore(CheckpointStore checkpointStore) {
      this.checkpointStore = checkpointStore;
      return this;
    }

    /**
     * Optional. Without a purger {@link SyncQueue#cleanupOldItems} throws
     * {@link IllegalStateException}.
     */
    public Builder purger(ItemPurger purger) {
      this.purger = purger;
      return this;
    }

    /** Optional. Defaults to {@link BackoffSchedule#DEFAULT}. */
    public Builder backoffSchedule(BackoffSchedule backoff) {
      this.backoff = backoff;
      return this;
    }

    /** Optional. Defaults to {@link Clock#systemUTC()}. All stored times come from this clock. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets how long a claim stays live without renewal.
     *
     * <p>Optional. Defaults to 30 minutes. Must be &gt; 0.
     */
    public Builder leaseDuration(Duration leaseDuration) {
      this.leaseDuration = leaseDuration;
      return this;
    }

    /**
     * Sets the age after which a PROCESSING item counts as stuck, both for
     * {@link SyncQueue#resetStuckItems()} and for health reporting.
     *
     * <p>Optional. Defaults to 30 minutes. Must be &ge; the lease duration,
     * since an item whose lease is still live is never treated as stuck.
     */
    public Builder stuckThreshold(Duration stuckThreshold) {
      this.stuckThreshold = stuckThreshold;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * @throws NullPointerException if a required component is missing
     * @throws IllegalArgumentException if a duration is out of range
     */
    public SyncQueue build() {
      return new SyncQueue(this);
    }
  }
}
