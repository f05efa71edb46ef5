package io.syncqueue.jdbc.checkpoint;

import io.syncqueue.jdbc.JdbcRegistry;

import javax.sql.DataSource;
import java.util.List;

/**
 * Registry for JDBC checkpoint stores, loaded via {@link java.util.ServiceLoader} from
 * {@code META-INF/services/io.syncqueue.jdbc.checkpoint.AbstractJdbcCheckpointStore}.
 *
 * @see io.syncqueue.jdbc.store.JdbcQueueStores
 */
public final class JdbcCheckpointStores {

  private static final JdbcRegistry<AbstractJdbcCheckpointStore> REGISTRY =
      new JdbcRegistry<>(AbstractJdbcCheckpointStore.class, "checkpoint store");

  private JdbcCheckpointStores() {
  }

  public static List<AbstractJdbcCheckpointStore> all() {
    return REGISTRY.all();
  }

  public static AbstractJdbcCheckpointStore get(String name) {
    return REGISTRY.get(name);
  }

  public static AbstractJdbcCheckpointStore detect(DataSource dataSource) {
    return REGISTRY.detect(dataSource);
  }

  public static AbstractJdbcCheckpointStore detect(String jdbcUrl) {
    return REGISTRY.detect(jdbcUrl);
  }
}
