package io.syncqueue.jdbc.store;

import io.syncqueue.jdbc.JdbcRegistry;

import javax.sql.DataSource;
import java.util.List;

/**
 * Registry for JDBC queue stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link java.util.ServiceLoader} from
 * {@code META-INF/services/io.syncqueue.jdbc.store.AbstractJdbcQueueStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcQueueStore store = JdbcQueueStores.detect(dataSource);
 *
 * // Auto-detect from JDBC URL, custom table
 * AbstractJdbcQueueStore store = JdbcQueueStores.detect("jdbc:mysql://localhost/mydb")
 *     .withTableName("teamwork_queue");
 *
 * // Get by name
 * AbstractJdbcQueueStore store = JdbcQueueStores.get("postgresql");
 * }</pre>
 */
public final class JdbcQueueStores {

  private static final JdbcRegistry<AbstractJdbcQueueStore> REGISTRY =
      new JdbcRegistry<>(AbstractJdbcQueueStore.class, "queue store");

  private JdbcQueueStores() {
  }

  /** Returns all registered queue stores. */
  public static List<AbstractJdbcQueueStore> all() {
    return REGISTRY.all();
  }

  /**
   * Gets a queue store by name (case-insensitive).
   *
   * @throws IllegalArgumentException if no queue store is registered under that name
   */
  public static AbstractJdbcQueueStore get(String name) {
    return REGISTRY.get(name);
  }

  /**
   * Auto-detects the queue store from a DataSource's JDBC URL.
   *
   * @throws IllegalStateException if the URL cannot be read
   * @throws IllegalArgumentException if no queue store matches
   */
  public static AbstractJdbcQueueStore detect(DataSource dataSource) {
    return REGISTRY.detect(dataSource);
  }

  /**
   * Auto-detects the queue store from a JDBC URL.
   *
   * @throws IllegalArgumentException if no queue store matches
   */
  public static AbstractJdbcQueueStore detect(String jdbcUrl) {
    return REGISTRY.detect(jdbcUrl);
  }
}
