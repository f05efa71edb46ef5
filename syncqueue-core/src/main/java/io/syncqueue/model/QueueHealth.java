package io.syncqueue.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Per-source aggregate over the queue, derived at read time.
 *
 * @param source              the source system
 * @param pending             items waiting for a claim, including scheduled retries
 * @param processing          items currently claimed
 * @param failed              pending items that already failed at least once
 * @param deadLetter          items in the terminal failure state
 * @param avgProcessingTimeMs mean recorded processing time of completed items, {@code null} if none
 * @param oldestPendingAge    age of the oldest pending item, {@code null} if none
 * @param stuck               processing items claimed longer ago than the stuck threshold
 * @param lastProcessedAt     most recent completion, {@code null} if none
 */
public record QueueHealth(
    Source source,
    long pending,
    long processing,
    long failed,
    long deadLetter,
    Double avgProcessingTimeMs,
    Duration oldestPendingAge,
    long stuck,
    Instant lastProcessedAt
) {

  public static QueueHealth empty(Source source) {
    return new QueueHealth(source, 0, 0, 0, 0, null, null, 0, null);
  }
}
