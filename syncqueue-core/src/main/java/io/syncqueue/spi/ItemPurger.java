package io.syncqueue.spi;

import java.sql.Connection;
import java.time.Instant;

/**
 * Deletes COMPLETED queue items past their retention. DEAD_LETTER items are
 * never purged.
 *
 * @see io.syncqueue.maintenance.RetentionSweeper
 */
@FunctionalInterface
public interface ItemPurger {

  /**
   * Deletes up to {@code limit} COMPLETED items whose {@code processed_at} is
   * before {@code processedBefore}.
   *
   * @return the number of rows deleted
   */
  int purge(Connection conn, Instant processedBefore, int limit);
}
