package io.syncqueue.spi;

import io.syncqueue.QueueEvent;
import io.syncqueue.model.ItemStatus;
import io.syncqueue.model.QueueHealth;
import io.syncqueue.model.QueueItem;
import io.syncqueue.model.RecentError;
import io.syncqueue.model.Source;
import io.syncqueue.retry.BackoffSchedule;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Persistence contract for queue items and their state machine:
 * PENDING → PROCESSING → COMPLETED | PENDING (retry) | DEAD_LETTER, and
 * PROCESSING → PENDING on reclaim.
 *
 * <p>Every mutator is a single statement against the store, so it is atomic on
 * its own. All methods receive an explicit {@link Connection}; the caller owns
 * transaction boundaries and closes the connection. Times are passed in by the
 * caller rather than read from the database clock.
 *
 * @see io.syncqueue.jdbc.store.AbstractJdbcQueueStore
 */
public interface QueueStore {

  /**
   * Inserts a new PENDING item.
   *
   * @return the generated item id
   */
  long insert(Connection conn, QueueEvent event, Instant now);

  /**
   * Inserts multiple PENDING items. Default loops {@link #insert}.
   *
   * @return generated ids, in input order
   */
  default List<Long> insertBatch(Connection conn, List<QueueEvent> events, Instant now) {
    List<Long> ids = new ArrayList<>(events.size());
    for (QueueEvent event : events) {
      ids.add(insert(conn, event, now));
    }
    return ids;
  }

  /**
   * Inserts a PENDING item unless a PENDING or PROCESSING item with the same
   * source, event type and external id already exists.
   *
   * <p>The check and the insert are one statement but no unique constraint backs
   * them, so two racing producers can still both insert.
   *
   * @return the new id, or empty if an active duplicate was found
   */
  OptionalLong insertIfAbsent(Connection conn, QueueEvent event, Instant now);

  Optional<QueueItem> findById(Connection conn, long id);

  /**
   * Claims up to {@code limit} eligible items for {@code workerId}.
   *
   * <p>Eligible means PENDING with {@code next_retry_at} null or {@code <= now},
   * optionally restricted to {@code source}, oldest {@code created_at} first.
   * Claimed rows move to PROCESSING with {@code processing_started_at = now}, the
   * worker id, a fresh lease token and {@code lease_expires_at = leaseExpiresAt}.
   * Rows locked by a concurrent claim are skipped, never waited on.
   *
   * @param source optional source filter ({@code null} for all)
   * @return the claimed items, oldest first; empty when nothing is eligible
   */
  List<QueueItem> claim(Connection conn, String workerId, Source source,
      Instant now, Instant leaseExpiresAt, int limit);

  /**
   * Extends the lease of a PROCESSING item held by {@code workerId}.
   *
   * @return the number of rows updated (0 or 1)
   */
  int renewLease(Connection conn, long id, String workerId, Instant now, Instant leaseExpiresAt);

  /**
   * Marks an item COMPLETED and records its processing time. Re-completing a
   * completed item overwrites the fields; a DEAD_LETTER item is left alone.
   *
   * @param processingTimeMs processing time, may be {@code null}
   * @return the number of rows updated (0 or 1)
   */
  int markCompleted(Connection conn, long id, Long processingTimeMs, Instant now);

  /**
   * Records a failed attempt. When {@code retry} is set and the item's retry
   * count is below its max retries, the item returns to PENDING with the count
   * incremented and {@code next_retry_at} taken from {@code backoff} at the
   * pre-increment count. Otherwise it moves to DEAD_LETTER. COMPLETED and
   * DEAD_LETTER items are not touched.
   *
   * @return the resulting status, or empty if no row was updated
   */
  Optional<ItemStatus> markFailed(Connection conn, long id, String error, boolean retry,
      BackoffSchedule backoff, Instant now);

  /**
   * Returns PROCESSING items claimed before {@code startedBefore} to PENDING,
   * skipping items whose lease is still live at {@code now}. Retry counts are
   * not changed.
   *
   * @return the number of items reset
   */
  int resetStuck(Connection conn, Instant startedBefore, Instant now);

  /**
   * Returns PROCESSING items whose lease expired at or before {@code now} to
   * PENDING. Retry counts are not changed.
   *
   * @return the number of items reset
   */
  int reclaimExpiredLeases(Connection conn, Instant now);

  /**
   * Aggregates counts and ages per source. Sources without rows are omitted.
   *
   * @param stuckBefore PROCESSING items claimed before this instant count as stuck,
   *                    unless their lease is still live at {@code now} (the same rule as {@link #resetStuck})
   */
  List<QueueHealth> queryHealth(Connection conn, Instant now, Instant stuckBefore);

  /**
   * Items that are dead-lettered or waiting for a retry and were updated after
   * {@code since}, newest first.
   */
  List<RecentError> queryRecentErrors(Connection conn, Instant since, int limit);

  /**
   * DEAD_LETTER items, oldest first.
   *
   * @param source optional source filter ({@code null} for all)
   */
  List<QueueItem> queryDeadLetters(Connection conn, Source source, int limit);

  /**
   * @param source optional source filter ({@code null} for all)
   */
  long countDeadLetters(Connection conn, Source source);
}
