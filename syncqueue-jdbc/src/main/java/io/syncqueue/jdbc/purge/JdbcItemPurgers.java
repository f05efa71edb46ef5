package io.syncqueue.jdbc.purge;

import io.syncqueue.jdbc.JdbcRegistry;

import javax.sql.DataSource;
import java.util.List;

/**
 * Registry for JDBC item purgers, loaded via {@link java.util.ServiceLoader} from
 * {@code META-INF/services/io.syncqueue.jdbc.purge.AbstractJdbcItemPurger}.
 *
 * @see io.syncqueue.jdbc.store.JdbcQueueStores
 */
public final class JdbcItemPurgers {

  private static final JdbcRegistry<AbstractJdbcItemPurger> REGISTRY =
      new JdbcRegistry<>(AbstractJdbcItemPurger.class, "item purger");

  private JdbcItemPurgers() {
  }

  public static List<AbstractJdbcItemPurger> all() {
    return REGISTRY.all();
  }

  public static AbstractJdbcItemPurger get(String name) {
    return REGISTRY.get(name);
  }

  public static AbstractJdbcItemPurger detect(DataSource dataSource) {
    return REGISTRY.detect(dataSource);
  }

  public static AbstractJdbcItemPurger detect(String jdbcUrl) {
    return REGISTRY.detect(jdbcUrl);
  }
}
