package io.syncqueue.jdbc.purge;

import java.util.List;

/**
 * H2 item purger. Uses the default subquery-based delete.
 */
public final class H2ItemPurger extends AbstractJdbcItemPurger {

  public H2ItemPurger() {
    super();
  }

  public H2ItemPurger(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcItemPurger withTableName(String tableName) {
    return new H2ItemPurger(tableName);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
