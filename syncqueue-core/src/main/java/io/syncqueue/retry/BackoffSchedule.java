package io.syncqueue.retry;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Step table of retry delays, indexed by an item's retry count <em>before</em>
 * the failing attempt is counted. Counts past the end of the table reuse the
 * last step.
 *
 * <p>{@link #DEFAULT} is {@code 1m, 5m, 15m, 30m, 60m}.
 */
public final class BackoffSchedule {

  public static final BackoffSchedule DEFAULT = of(
      Duration.ofMinutes(1),
      Duration.ofMinutes(5),
      Duration.ofMinutes(15),
      Duration.ofMinutes(30),
      Duration.ofMinutes(60));

  private final List<Duration> steps;

  private BackoffSchedule(List<Duration> steps) {
    if (steps.isEmpty()) {
      throw new IllegalArgumentException("steps must not be empty");
    }
    for (Duration step : steps) {
      Objects.requireNonNull(step, "step");
      if (step.isNegative()) {
        throw new IllegalArgumentException("step must be >= 0, got: " + step);
      }
    }
    this.steps = List.copyOf(steps);
  }

  public static BackoffSchedule of(Duration... steps) {
    return new BackoffSchedule(List.of(steps));
  }

  public static BackoffSchedule of(List<Duration> steps) {
    return new BackoffSchedule(steps);
  }

  /** The delay applied to a failure of an item that has already been retried {@code retryCount} times. */
  public Duration delayFor(int retryCount) {
    if (retryCount < 0) {
      throw new IllegalArgumentException("retryCount must be >= 0, got: " + retryCount);
    }
    return steps.get(Math.min(retryCount, steps.size() - 1));
  }

  public Instant nextRetryAt(Instant now, int retryCount) {
    return now.plus(delayFor(retryCount));
  }

  /** Steps in order; the last one applies to every higher retry count. */
  public List<Duration> steps() {
    return steps;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof BackoffSchedule other && steps.equals(other.steps);
  }

  @Override
  public int hashCode() {
    return steps.hashCode();
  }

  @Override
  public String toString() {
    return "BackoffSchedule" + steps;
  }
}
