package io.syncqueue.jdbc.purge;

import io.syncqueue.jdbc.JdbcDialectComponent;
import io.syncqueue.jdbc.JdbcTemplate;
import io.syncqueue.jdbc.TableNames;
import io.syncqueue.model.ItemStatus;
import io.syncqueue.spi.ItemPurger;

import java.sql.Connection;
import java.time.Instant;

import static io.syncqueue.jdbc.JdbcTemplate.timestamp;

/**
 * Base JDBC item purger with default subquery-based SQL that works for H2
 * and PostgreSQL.
 *
 * <p>Only COMPLETED items are deleted. Subclasses may override {@link #purge}
 * for databases that support more efficient syntax (e.g. MySQL supports
 * {@code DELETE ... ORDER BY ... LIMIT}).
 *
 * @see JdbcItemPurgers
 */
public abstract class AbstractJdbcItemPurger implements ItemPurger, JdbcDialectComponent {

  protected static final String COMPLETED = "'" + ItemStatus.COMPLETED.dbValue() + "'";

  private final String tableName;

  protected AbstractJdbcItemPurger() {
    this(TableNames.DEFAULT_QUEUE_TABLE);
  }

  protected AbstractJdbcItemPurger(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  /**
   * Returns a purger of the same dialect over a different table.
   */
  public abstract AbstractJdbcItemPurger withTableName(String tableName);

  protected String tableName() {
    return tableName;
  }

  /**
   * Deletes COMPLETED items processed before {@code processedBefore}, up to
   * {@code limit} rows, oldest first.
   */
  @Override
  public int purge(Connection conn, Instant processedBefore, int limit) {
    String sql = "DELETE FROM " + tableName() + " WHERE id IN (" +
        "SELECT id FROM " + tableName() +
        " WHERE status=" + COMPLETED + " AND processed_at < ?" +
        " ORDER BY processed_at, id LIMIT ?)";
    return JdbcTemplate.update(conn, sql, timestamp(processedBefore), limit);
  }
}
