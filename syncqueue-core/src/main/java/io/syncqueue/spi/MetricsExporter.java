package io.syncqueue.spi;

import io.syncqueue.model.QueueHealth;
import io.syncqueue.model.Source;

/**
 * Observability hook for exporting queue counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 *
 * @see io.syncqueue.micrometer.MicrometerMetricsExporter
 */
public interface MetricsExporter {

  MetricsExporter NOOP = new Noop();

  void incrementEnqueued(Source source);

  /** Items handed to workers by a single dequeue call. */
  void incrementClaimed(int count);

  void incrementCompleted();

  /** Failures that put the item back to PENDING with a backoff. */
  void incrementRetried();

  void incrementDeadLettered();

  /** Items returned to PENDING by the stuck-item sweep or lease expiry. */
  void incrementReclaimed(int count);

  /** Completed items deleted by retention. */
  void incrementPurged(int count);

  /**
   * Records the processing time reported on completion.
   *
   * @param durationMs processing time in milliseconds (always non-negative)
   */
  default void recordProcessingTimeMs(long durationMs) {
  }

  /**
   * Publishes a freshly computed health snapshot for one source.
   */
  default void recordHealth(QueueHealth health) {
  }

  final class Noop implements MetricsExporter {
    @Override
    public void incrementEnqueued(Source source) {
    }

    @Override
    public void incrementClaimed(int count) {
    }

    @Override
    public void incrementCompleted() {
    }

    @Override
    public void incrementRetried() {
    }

    @Override
    public void incrementDeadLettered() {
    }

    @Override
    public void incrementReclaimed(int count) {
    }

    @Override
    public void incrementPurged(int count) {
    }
  }
}
