package io.syncqueue.dead;

import io.syncqueue.QueueStoreException;
import io.syncqueue.model.QueueItem;
import io.syncqueue.model.Source;
import io.syncqueue.spi.ConnectionProvider;
import io.syncqueue.spi.QueueStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;

/**
 * Read-only access to dead-lettered items for operators.
 *
 * <p>Dead-lettered items are never revived or deleted automatically; any
 * requeue or cleanup is an operator decision made outside this library.
 *
 * @see QueueStore#queryDeadLetters
 * @see QueueStore#countDeadLetters
 */
public final class DeadLetterInspector {
  private final ConnectionProvider connectionProvider;
  private final QueueStore queueStore;

  public DeadLetterInspector(ConnectionProvider connectionProvider, QueueStore queueStore) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.queueStore = Objects.requireNonNull(queueStore, "queueStore");
  }

  /**
   * @param source optional source filter ({@code null} for all)
   * @param limit  maximum number of items to return
   * @return dead-lettered items, oldest first
   */
  public List<QueueItem> query(Source source, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return queueStore.queryDeadLetters(conn, source, limit);
    } catch (SQLException e) {
      throw new QueueStoreException("Failed to query dead letters", e);
    }
  }

  /**
   * @param source optional source filter ({@code null} for all)
   */
  public long count(Source source) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return queueStore.countDeadLetters(conn, source);
    } catch (SQLException e) {
      throw new QueueStoreException("Failed to count dead letters", e);
    }
  }
}
