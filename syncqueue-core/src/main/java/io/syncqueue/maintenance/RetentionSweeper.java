package io.syncqueue.maintenance;

import io.syncqueue.SyncQueue;
import io.syncqueue.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled component that deletes COMPLETED items older than a retention
 * period.
 *
 * <p>Each cycle deletes in batches (default 500) until fewer than
 * {@code batchSize} rows are deleted, then sleeps until the next interval.
 * Each batch uses its own auto-committed connection to limit lock duration.
 * Dead-lettered items are never deleted.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see SyncQueue#cleanupOldItems(Duration, int)
 */
public final class RetentionSweeper implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(RetentionSweeper.class.getName());

  private final SyncQueue syncQueue;
  private final Duration retention;
  private final int batchSize;
  private final long intervalSeconds;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> sweepTask;
  private volatile boolean closed;

  private RetentionSweeper(Builder builder) {
    this.syncQueue = Objects.requireNonNull(builder.syncQueue, "syncQueue");

    if (builder.retention != null && builder.retention.isNegative()) {
      throw new IllegalArgumentException("retention must be >= 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.intervalSeconds <= 0L) {
      throw new IllegalArgumentException("intervalSeconds must be > 0");
    }

    this.retention = builder.retention != null ? builder.retention : SyncQueue.DEFAULT_RETENTION;
    this.batchSize = builder.batchSize;
    this.intervalSeconds = builder.intervalSeconds;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled sweep. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("RetentionSweeper has been closed");
    }
    if (sweepTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("syncqueue-retention-"));
    sweepTask = scheduler.scheduleWithFixedDelay(
        this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
  }

  /**
   * Executes a single sweep. May be invoked directly for testing or one-off cleanups.
   *
   * @return the number of items deleted, or 0 if the cycle failed
   */
  public int runOnce() {
    if (closed) {
      return 0;
    }
    try {
      return syncQueue.cleanupOldItems(retention, batchSize);
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Retention cycle failed", t);
      return 0;
    }
  }

  /** Cancels the schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (sweepTask != null) {
      sweepTask.cancel(false);
      sweepTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link RetentionSweeper}. */
  public static final class Builder {
    private SyncQueue syncQueue;
    private Duration retention;
    private int batchSize = SyncQueue.DEFAULT_PURGE_BATCH_SIZE;
    private long intervalSeconds = 3600;

    private Builder() {}

    /**
     * <b>Required.</b> Must have been built with an
     * {@link io.syncqueue.spi.ItemPurger}.
     */
    public Builder syncQueue(SyncQueue syncQueue) {
      this.syncQueue = syncQueue;
      return this;
    }

    /**
     * Sets how long COMPLETED items are kept after {@code processed_at}.
     *
     * <p>Optional. Defaults to {@code 7 days}. Must be &ge; 0.
     */
    public Builder retention(Duration retention) {
      this.retention = retention;
      return this;
    }

    /**
     * Optional. Defaults to {@code 500}. Must be &gt; 0.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Optional. Defaults to {@code 3600} (1 hour). Must be &gt; 0.
     */
    public Builder intervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
      return this;
    }

    public RetentionSweeper build() {
      return new RetentionSweeper(this);
    }
  }
}
