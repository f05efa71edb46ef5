package io.syncqueue.worker;

import io.syncqueue.SyncQueue;
import io.syncqueue.model.QueueItem;
import io.syncqueue.model.Source;
import io.syncqueue.util.DaemonThreadFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Polling consumer that drains a {@link SyncQueue} into a {@link QueueItemHandler}.
 *
 * <p>Runs {@code concurrency} independent loops. Each loop has its own worker
 * id ({@code <workerIdPrefix>-1}, {@code -2}, ...), claims up to
 * {@code batchSize} items per cycle and handles them one by one. Before each
 * item after the first, the loop renews its lease; an item whose lease could
 * not be renewed has been reclaimed and is skipped.
 *
 * <p>Loops never coordinate in memory. Mutual exclusion comes from the
 * skip-locked claim in the store, so several {@code QueueWorker} instances in
 * different processes may drain the same queue.
 *
 * <p>Create instances via {@link #builder()}. {@link #start()} and
 * {@link #close()} are synchronized.
 *
 * @see QueueWorker.Builder
 */
public final class QueueWorker implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(QueueWorker.class.getName());

  private final SyncQueue syncQueue;
  private final QueueItemHandler handler;
  private final Source source;
  private final String workerIdPrefix;
  private final int batchSize;
  private final long intervalMs;
  private final int concurrency;

  private ScheduledExecutorService scheduler;
  private final List<ScheduledFuture<?>> loops = new ArrayList<>();
  private volatile boolean closed;

  private QueueWorker(Builder builder) {
    this.syncQueue = Objects.requireNonNull(builder.syncQueue, "syncQueue");
    this.handler = Objects.requireNonNull(builder.handler, "handler");

    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.intervalMs <= 0L) {
      throw new IllegalArgumentException("intervalMs must be > 0");
    }
    if (builder.concurrency <= 0) {
      throw new IllegalArgumentException("concurrency must be > 0");
    }

    this.source = builder.source;
    this.workerIdPrefix = builder.workerIdPrefix != null
        ? builder.workerIdPrefix
        : "worker-" + UUID.randomUUID().toString().substring(0, 8);
    this.batchSize = builder.batchSize;
    this.intervalMs = builder.intervalMs;
    this.concurrency = builder.concurrency;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the polling loops. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("QueueWorker has been closed");
    }
    if (!loops.isEmpty()) {
      return;
    }
    scheduler = Executors.newScheduledThreadPool(concurrency, new DaemonThreadFactory("syncqueue-worker-"));
    for (int i = 1; i <= concurrency; i++) {
      String workerId = workerId(i);
      loops.add(scheduler.scheduleWithFixedDelay(
          () -> poll(workerId), 0, intervalMs, TimeUnit.MILLISECONDS));
    }
    logger.log(Level.INFO, "Started {0} worker loops with prefix {1}",
        new Object[]{concurrency, workerIdPrefix});
  }

  /**
   * Executes a single cycle as the first worker loop. May be invoked directly
   * for testing.
   *
   * @return the number of items handled
   */
  public int runOnce() {
    return poll(workerId(1));
  }

  String workerId(int slot) {
    return workerIdPrefix + "-" + slot;
  }

  private int poll(String workerId) {
    if (closed) {
      return 0;
    }
    try {
      List<QueueItem> items = syncQueue.dequeue(workerId, batchSize, source);
      int handled = 0;
      for (int i = 0; i < items.size(); i++) {
        if (closed) {
          break;
        }
        QueueItem item = items.get(i);
        if (i > 0 && !syncQueue.renewLease(item.id(), workerId)) {
          logger.log(Level.WARNING, "Lease of item {0} lost before handling; skipping", item.id());
          continue;
        }
        process(item);
        handled++;
      }
      return handled;
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Worker cycle failed for " + workerId, t);
      return 0;
    }
  }

  private void process(QueueItem item) {
    long start = System.nanoTime();
    try {
      handler.handle(item);
    } catch (NonRetryableException e) {
      fail(item, e, false);
      return;
    } catch (Throwable t) {
      // errors included: every handler failure is charged to the item
      fail(item, t, true);
      return;
    }
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    try {
      syncQueue.markCompleted(item.id(), elapsedMs);
    } catch (RuntimeException e) {
      // Item stays PROCESSING until its lease expires and is then handled again.
      logger.log(Level.SEVERE, "Failed to mark item " + item.id() + " completed", e);
    }
  }

  private void fail(QueueItem item, Throwable failure, boolean retry) {
    try {
      syncQueue.markFailed(item.id(), describe(failure), retry);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to record failure of item " + item.id(), e);
    }
  }

  private static String describe(Throwable failure) {
    String message = failure.getMessage();
    return message == null
        ? failure.getClass().getName()
        : failure.getClass().getSimpleName() + ": " + message;
  }

  /** Cancels all loops and shuts down the worker threads. */
  @Override
  public synchronized void close() {
    closed = true;
    for (ScheduledFuture<?> loop : loops) {
      loop.cancel(false);
    }
    loops.clear();
    if (scheduler != null) {
      scheduler.shutdown();
      try {
        if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
          scheduler.shutdownNow();
        }
      } catch (InterruptedException e) {
        scheduler.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link QueueWorker}. */
  public static final class Builder {
    private SyncQueue syncQueue;
    private QueueItemHandler handler;
    private Source source;
    private String workerIdPrefix;
    private int batchSize = 10;
    private long intervalMs = 1000;
    private int concurrency = 1;

    private Builder() {}

    /** <b>Required.</b> */
    public Builder syncQueue(SyncQueue syncQueue) {
      this.syncQueue = syncQueue;
      return this;
    }

    /** <b>Required.</b> */
    public Builder handler(QueueItemHandler handler) {
      this.handler = handler;
      return this;
    }

    /** Optional. Restricts claims to one source; {@code null} (default) claims from all. */
    public Builder source(Source source) {
      this.source = source;
      return this;
    }

    /**
     * Sets the prefix of the worker ids stamped on claimed items.
     *
     * <p>Optional. Defaults to {@code worker-} followed by a random suffix.
     */
    public Builder workerIdPrefix(String workerIdPrefix) {
      this.workerIdPrefix = workerIdPrefix;
      return this;
    }

    /** Optional. Defaults to {@code 10}. Must be &gt; 0. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /** Optional. Delay between cycles of one loop. Defaults to {@code 1000}. Must be &gt; 0. */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    /** Optional. Number of independent loops. Defaults to {@code 1}. Must be &gt; 0. */
    public Builder concurrency(int concurrency) {
      this.concurrency = concurrency;
      return this;
    }

    public QueueWorker build() {
      return new QueueWorker(this);
    }
  }
}
