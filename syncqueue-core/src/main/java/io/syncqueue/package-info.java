/**
 * Durable work queue with per-source checkpoints.
 *
 * <p>{@link io.syncqueue.SyncQueue} is the entry point. Items move
 * PENDING → PROCESSING → COMPLETED, back to PENDING for a retry, or to
 * DEAD_LETTER. Any number of workers may claim concurrently; the backing store
 * is the only coordination point.
 */
package io.syncqueue;
