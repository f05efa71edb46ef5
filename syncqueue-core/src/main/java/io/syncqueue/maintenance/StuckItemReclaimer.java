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
 * Scheduled crash-recovery sweep that returns abandoned claims to PENDING.
 *
 * <p>Each cycle first reclaims items whose lease has expired, then resets items
 * that have been PROCESSING for longer than the stuck threshold and hold no
 * live lease. Neither step counts as a failure, so retry counts are unchanged.
 *
 * <p>A slow worker that outlives its lease can have its item handed to another
 * worker; handlers must be idempotent.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see SyncQueue#reclaimExpiredLeases()
 * @see SyncQueue#resetStuckItems(Duration)
 */
public final class StuckItemReclaimer implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(StuckItemReclaimer.class.getName());

  private final SyncQueue syncQueue;
  private final Duration stuckThreshold;
  private final long intervalSeconds;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> reclaimTask;
  private volatile boolean closed;

  private StuckItemReclaimer(Builder builder) {
    this.syncQueue = Objects.requireNonNull(builder.syncQueue, "syncQueue");

    if (builder.stuckThreshold != null && builder.stuckThreshold.compareTo(syncQueue.leaseDuration()) < 0) {
      throw new IllegalArgumentException("stuckThreshold must be >= the queue's leaseDuration");
    }
    if (builder.intervalSeconds <= 0L) {
      throw new IllegalArgumentException("intervalSeconds must be > 0");
    }

    this.stuckThreshold = builder.stuckThreshold != null ? builder.stuckThreshold : syncQueue.stuckThreshold();
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
      throw new IllegalStateException("StuckItemReclaimer has been closed");
    }
    if (reclaimTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("syncqueue-reclaim-"));
    reclaimTask = scheduler.scheduleWithFixedDelay(
        this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
  }

  /**
   * Executes a single sweep. May be invoked directly for testing.
   *
   * @return the number of items returned to PENDING, or 0 if the cycle failed
   */
  public int runOnce() {
    if (closed) {
      return 0;
    }
    try {
      return syncQueue.reclaimExpiredLeases() + syncQueue.resetStuckItems(stuckThreshold);
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Reclaim cycle failed", t);
      return 0;
    }
  }

  /** Cancels the schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (reclaimTask != null) {
      reclaimTask.cancel(false);
      reclaimTask = null;
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

  /** Builder for {@link StuckItemReclaimer}. */
  public static final class Builder {
    private SyncQueue syncQueue;
    private Duration stuckThreshold;
    private long intervalSeconds = 60;

    private Builder() {}

    /** <b>Required.</b> */
    public Builder syncQueue(SyncQueue syncQueue) {
      this.syncQueue = syncQueue;
      return this;
    }

    /**
     * Optional. Defaults to the queue's own {@link SyncQueue#stuckThreshold()}.
     * Must be &ge; the queue's {@link SyncQueue#leaseDuration()}.
     */
    public Builder stuckThreshold(Duration stuckThreshold) {
      this.stuckThreshold = stuckThreshold;
      return this;
    }

    /**
     * Optional. Defaults to {@code 60}. Must be &gt; 0.
     */
    public Builder intervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
      return this;
    }

    public StuckItemReclaimer build() {
      return new StuckItemReclaimer(this);
    }
  }
}
