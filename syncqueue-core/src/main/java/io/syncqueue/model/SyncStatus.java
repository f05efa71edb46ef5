package io.syncqueue.model;

import java.time.Instant;

/**
 * Checkpoint and queue state for one source, combined for dashboard display.
 * Checkpoint fields are {@code null} when the source was never checkpointed.
 */
public record SyncStatus(
    Source source,
    Instant lastEventTime,
    Instant checkpointUpdatedAt,
    long pending,
    long processing,
    long failed,
    Instant lastProcessedAt
) {}
