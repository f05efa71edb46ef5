package io.syncqueue.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.syncqueue.model.QueueHealth;
import io.syncqueue.model.Source;
import io.syncqueue.spi.MetricsExporter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters, a processing-time summary and per-source health
 * gauges with a {@link MeterRegistry}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code syncqueue.items.enqueued} (tag {@code source}): items inserted by producers</li>
 *   <li>{@code syncqueue.items.claimed}: items handed to workers</li>
 *   <li>{@code syncqueue.items.completed}: items marked completed</li>
 *   <li>{@code syncqueue.items.retried}: failures scheduled for retry</li>
 *   <li>{@code syncqueue.items.dead_lettered}: items moved to dead letter</li>
 *   <li>{@code syncqueue.items.reclaimed}: abandoned items returned to pending</li>
 *   <li>{@code syncqueue.items.purged}: completed items deleted by retention</li>
 * </ul>
 *
 * <h3>Summary</h3>
 * <ul>
 *   <li>{@code syncqueue.processing.time}: reported processing time, in milliseconds</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * All tagged {@code source}; updated whenever queue health is evaluated.
 * <ul>
 *   <li>{@code syncqueue.queue.pending}, {@code .processing}, {@code .failed},
 *       {@code .dead_letter}, {@code .stuck}: item counts</li>
 *   <li>{@code syncqueue.queue.oldest.pending.age.ms}: age of the oldest pending item, 0 if none</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Map<Source, Counter> enqueued = new EnumMap<>(Source.class);
  private final Counter claimed;
  private final Counter completed;
  private final Counter retried;
  private final Counter deadLettered;
  private final Counter reclaimed;
  private final Counter purged;
  private final DistributionSummary processingTime;
  private final Map<Source, HealthGauges> health = new EnumMap<>(Source.class);
  private final List<Meter> meters = new ArrayList<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "syncqueue"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "syncqueue");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param namePrefix prefix for all meter names (e.g. {@code "billing.syncqueue"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    for (Source source : Source.values()) {
      enqueued.put(source, track(Counter.builder(namePrefix + ".items.enqueued")
          .description("Items inserted by producers")
          .tag("source", source.dbValue())
          .register(registry)));
    }
    this.claimed = counter(namePrefix + ".items.claimed", "Items handed to workers");
    this.completed = counter(namePrefix + ".items.completed", "Items marked completed");
    this.retried = counter(namePrefix + ".items.retried", "Failures scheduled for retry");
    this.deadLettered = counter(namePrefix + ".items.dead_lettered", "Items moved to dead letter");
    this.reclaimed = counter(namePrefix + ".items.reclaimed", "Abandoned items returned to pending");
    this.purged = counter(namePrefix + ".items.purged", "Completed items deleted by retention");
    this.processingTime = track(DistributionSummary.builder(namePrefix + ".processing.time")
        .description("Processing time reported on completion")
        .baseUnit("milliseconds")
        .register(registry));

    for (Source source : Source.values()) {
      health.put(source, new HealthGauges(namePrefix, source));
    }
  }

  @Override
  public void incrementEnqueued(Source source) {
    if (closed) return;
    enqueued.get(source).increment();
  }

  @Override
  public void incrementClaimed(int count) {
    if (closed) return;
    claimed.increment(count);
  }

  @Override
  public void incrementCompleted() {
    if (closed) return;
    completed.increment();
  }

  @Override
  public void incrementRetried() {
    if (closed) return;
    retried.increment();
  }

  @Override
  public void incrementDeadLettered() {
    if (closed) return;
    deadLettered.increment();
  }

  @Override
  public void incrementReclaimed(int count) {
    if (closed) return;
    reclaimed.increment(count);
  }

  @Override
  public void incrementPurged(int count) {
    if (closed) return;
    purged.increment(count);
  }

  @Override
  public void recordProcessingTimeMs(long durationMs) {
    if (closed) return;
    processingTime.record(durationMs);
  }

  @Override
  public void recordHealth(QueueHealth queueHealth) {
    if (closed) return;
    health.get(queueHealth.source()).update(queueHealth);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the queue is shut down to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }

  private Counter counter(String name, String description) {
    return track(Counter.builder(name).description(description).register(registry));
  }

  private <M extends Meter> M track(M meter) {
    meters.add(meter);
    return meter;
  }

  private final class HealthGauges {
    private final AtomicLong pending = new AtomicLong();
    private final AtomicLong processing = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong deadLetter = new AtomicLong();
    private final AtomicLong stuck = new AtomicLong();
    private final AtomicLong oldestPendingAgeMs = new AtomicLong();

    HealthGauges(String namePrefix, Source source) {
      gauge(namePrefix + ".queue.pending", source, pending);
      gauge(namePrefix + ".queue.processing", source, processing);
      gauge(namePrefix + ".queue.failed", source, failed);
      gauge(namePrefix + ".queue.dead_letter", source, deadLetter);
      gauge(namePrefix + ".queue.stuck", source, stuck);
      gauge(namePrefix + ".queue.oldest.pending.age.ms", source, oldestPendingAgeMs);
    }

    void update(QueueHealth h) {
      pending.set(h.pending());
      processing.set(h.processing());
      failed.set(h.failed());
      deadLetter.set(h.deadLetter());
      stuck.set(h.stuck());
      oldestPendingAgeMs.set(millis(h.oldestPendingAge()));
    }

    private void gauge(String name, Source source, AtomicLong value) {
      track(Gauge.builder(name, value, AtomicLong::get)
          .tag("source", source.dbValue())
          .register(registry));
    }
  }

  private static long millis(Duration duration) {
    return duration == null ? 0L : duration.toMillis();
  }
}
