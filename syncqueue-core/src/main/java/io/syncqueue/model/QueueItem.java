package io.syncqueue.model;

import java.time.Instant;

/**
 * Read-only snapshot of a persisted queue row.
 *
 * <p>{@code workerId}, {@code processingStartedAt} and {@code lease} are non-null
 * only while the item is {@link ItemStatus#PROCESSING}. {@code nextRetryAt} is set
 * only on a PENDING item that has been scheduled for retry.
 *
 * @see io.syncqueue.spi.QueueStore#claim
 */
public record QueueItem(
    long id,
    Source source,
    String eventType,
    String externalId,
    String payloadJson,
    ItemStatus status,
    int retryCount,
    int maxRetries,
    String errorMessage,
    Instant createdAt,
    Instant updatedAt,
    Instant processingStartedAt,
    Instant processedAt,
    Instant nextRetryAt,
    String workerId,
    Long processingTimeMs,
    Lease lease
) {
}
