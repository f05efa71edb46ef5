package io.syncqueue.model;

import java.time.Instant;

/**
 * A failed item as surfaced to operators. {@code errorMessage} is the caller's
 * text verbatim (truncated to the stored length).
 */
public record RecentError(
    long id,
    Source source,
    String eventType,
    String externalId,
    ItemStatus status,
    String errorMessage,
    int retryCount,
    Instant createdAt,
    Instant updatedAt
) {}
