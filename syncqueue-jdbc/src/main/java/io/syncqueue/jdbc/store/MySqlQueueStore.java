package io.syncqueue.jdbc.store;

import io.syncqueue.jdbc.JdbcTemplate;
import io.syncqueue.model.QueueItem;
import io.syncqueue.model.Source;

import java.sql.Connection;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

import static io.syncqueue.jdbc.JdbcTemplate.timestamp;

/**
 * MySQL 8 queue store. Also compatible with TiDB.
 *
 * <p>MySQL rejects {@code LIMIT} inside an {@code IN} subquery, so the claim
 * locks candidate ids with {@code SELECT ... FOR UPDATE SKIP LOCKED}, updates
 * them by id, then reads them back by lease token. All three statements must
 * share the caller's transaction.
 */
public final class MySqlQueueStore extends AbstractJdbcQueueStore {

  public MySqlQueueStore() {
    super();
  }

  public MySqlQueueStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcQueueStore withTableName(String tableName) {
    return new MySqlQueueStore(tableName);
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
  protected String timestampParam() {
    return "?";
  }

  @Override
  protected String fromDual() {
    return " FROM DUAL";
  }

  @Override
  public List<QueueItem> claim(Connection conn, String workerId, Source source,
      Instant now, Instant leaseExpiresAt, int limit) {
    String lockSql = "SELECT id FROM " + tableName() +
        " WHERE " + eligibleCondition(source) +
        " ORDER BY created_at, id LIMIT ? FOR UPDATE SKIP LOCKED";
    List<Long> ids = source != null
        ? JdbcTemplate.query(conn, lockSql, rs -> rs.getLong(1), timestamp(now), source.dbValue(), limit)
        : JdbcTemplate.query(conn, lockSql, rs -> rs.getLong(1), timestamp(now), limit);
    if (ids.isEmpty()) {
      return List.of();
    }
    String token = newLeaseToken();
    String updateSql = "UPDATE " + tableName() + " SET " + claimAssignments() +
        " WHERE id IN (" + String.join(",", Collections.nCopies(ids.size(), "?")) + ")";
    List<Object> params = claimParams(workerId, token, now, leaseExpiresAt);
    params.addAll(ids);
    JdbcTemplate.update(conn, updateSql, params.toArray());
    return selectClaimed(conn, token);
  }
}
