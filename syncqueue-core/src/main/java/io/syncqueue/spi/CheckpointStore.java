package io.syncqueue.spi;

import io.syncqueue.model.Checkpoint;
import io.syncqueue.model.Source;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for per-source resume positions. At most one row exists
 * per source; writes overwrite it.
 *
 * @see io.syncqueue.jdbc.checkpoint.AbstractJdbcCheckpointStore
 */
public interface CheckpointStore {

  Optional<Checkpoint> find(Connection conn, Source source);

  /** All checkpoints, ordered by source. */
  List<Checkpoint> findAll(Connection conn);

  /**
   * Inserts or overwrites the checkpoint for {@code source}.
   *
   * @param lastCursor opaque cursor, may be {@code null}
   */
  void upsert(Connection conn, Source source, Instant lastEventTime, String lastCursor, Instant now);

  /**
   * Refreshes {@code updated_at} without moving the position. Creates the
   * checkpoint at the Unix epoch if it does not exist.
   */
  void touch(Connection conn, Source source, Instant now);
}
