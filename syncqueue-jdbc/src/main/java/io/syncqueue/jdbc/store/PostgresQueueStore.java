package io.syncqueue.jdbc.store;

import io.syncqueue.jdbc.JdbcTemplate;
import io.syncqueue.model.ItemStatus;
import io.syncqueue.model.QueueItem;
import io.syncqueue.model.Source;
import io.syncqueue.retry.BackoffSchedule;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static io.syncqueue.jdbc.JdbcTemplate.timestamp;

/**
 * PostgreSQL queue store.
 *
 * <p>Uses {@code FOR UPDATE SKIP LOCKED} with {@code RETURNING} for a
 * single-round-trip claim: concurrent workers skip each other's rows instead
 * of waiting on them.
 */
public final class PostgresQueueStore extends AbstractJdbcQueueStore {

  public PostgresQueueStore() {
    super();
  }

  public PostgresQueueStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcQueueStore withTableName(String tableName) {
    return new PostgresQueueStore(tableName);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public List<QueueItem> claim(Connection conn, String workerId, Source source,
      Instant now, Instant leaseExpiresAt, int limit) {
    String sql = "UPDATE " + tableName() + " SET " + claimAssignments() +
        " WHERE id IN (SELECT id FROM " + tableName() +
        " WHERE " + eligibleCondition(source) +
        " ORDER BY created_at, id LIMIT ?" +
        " FOR UPDATE SKIP LOCKED" +
        ") RETURNING " + ITEM_COLUMNS;
    List<Object> params = claimParams(workerId, newLeaseToken(), now, leaseExpiresAt);
    params.add(timestamp(now));
    if (source != null) {
      params.add(source.dbValue());
    }
    params.add(limit);
    // RETURNING order is unspecified
    List<QueueItem> claimed = new ArrayList<>(
        JdbcTemplate.updateReturning(conn, sql, ITEM_ROW_MAPPER, params.toArray()));
    claimed.sort(CLAIM_ORDER);
    return claimed;
  }

  @Override
  public Optional<ItemStatus> markFailed(Connection conn, long id, String error, boolean retry,
      BackoffSchedule backoff, Instant now) {
    List<ItemStatus> status = retry
        ? JdbcTemplate.updateReturning(conn, retryOrDeadLetterSql(backoff) + " RETURNING status",
            rs -> ItemStatus.fromDbValue(rs.getString(1)), retryOrDeadLetterParams(id, error, backoff, now))
        : JdbcTemplate.updateReturning(conn, deadLetterSql() + " RETURNING status",
            rs -> ItemStatus.fromDbValue(rs.getString(1)), timestamp(now), error, timestamp(now), id);
    return status.isEmpty() ? Optional.empty() : Optional.of(status.get(0));
  }
}
