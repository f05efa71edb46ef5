package io.syncqueue.jdbc.purge;

import io.syncqueue.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

import static io.syncqueue.jdbc.JdbcTemplate.timestamp;

/**
 * MySQL item purger. Also compatible with TiDB.
 *
 * <p>Overrides with {@code DELETE ... ORDER BY ... LIMIT}, which MySQL supports
 * natively and avoids the self-referencing subquery MySQL rejects.
 */
public final class MySqlItemPurger extends AbstractJdbcItemPurger {

  public MySqlItemPurger() {
    super();
  }

  public MySqlItemPurger(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcItemPurger withTableName(String tableName) {
    return new MySqlItemPurger(tableName);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  public int purge(Connection conn, Instant processedBefore, int limit) {
    String sql = "DELETE FROM " + tableName() +
        " WHERE status=" + COMPLETED + " AND processed_at < ?" +
        " ORDER BY processed_at, id LIMIT ?";
    return JdbcTemplate.update(conn, sql, timestamp(processedBefore), limit);
  }
}
