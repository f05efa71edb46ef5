package io.syncqueue.jdbc.purge;

import java.util.List;

/**
 * PostgreSQL item purger. Uses the default subquery-based delete.
 */
public final class PostgresItemPurger extends AbstractJdbcItemPurger {

  public PostgresItemPurger() {
    super();
  }

  public PostgresItemPurger(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcItemPurger withTableName(String tableName) {
    return new PostgresItemPurger(tableName);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }
}
