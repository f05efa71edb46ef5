package io.syncqueue.model;

import java.time.Instant;

/**
 * Resume position of an incremental scan for one source.
 *
 * @param source        the source system (one row per source)
 * @param lastEventTime timestamp of the last event the scan consumed
 * @param lastCursor    opaque pagination token, may be {@code null}
 * @param updatedAt     when the checkpoint was last written
 */
public record Checkpoint(Source source, Instant lastEventTime, String lastCursor, Instant updatedAt) {}
