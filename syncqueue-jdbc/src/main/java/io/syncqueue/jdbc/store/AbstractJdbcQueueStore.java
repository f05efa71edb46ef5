package io.syncqueue.jdbc.store;

import io.syncqueue.QueueEvent;
import io.syncqueue.jdbc.JdbcDialectComponent;
import io.syncqueue.jdbc.JdbcTemplate;
import io.syncqueue.jdbc.TableNames;
import io.syncqueue.model.ItemStatus;
import io.syncqueue.model.Lease;
import io.syncqueue.model.QueueHealth;
import io.syncqueue.model.QueueItem;
import io.syncqueue.model.RecentError;
import io.syncqueue.model.Source;
import io.syncqueue.retry.BackoffSchedule;
import io.syncqueue.spi.QueueStore;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;

import static io.syncqueue.jdbc.JdbcTemplate.instant;
import static io.syncqueue.jdbc.JdbcTemplate.timestamp;

/**
 * Base JDBC queue store with standard SQL implementations.
 *
 * <p>Subclasses override {@link #claim} to provide database-specific claim
 * strategies. Register custom implementations via
 * {@code META-INF/services/io.syncqueue.jdbc.store.AbstractJdbcQueueStore}.
 *
 * @see JdbcQueueStores
 */
public abstract class AbstractJdbcQueueStore implements QueueStore, JdbcDialectComponent {

  protected static final String PENDING = quote(ItemStatus.PENDING);
  protected static final String PROCESSING = quote(ItemStatus.PROCESSING);
  protected static final String COMPLETED = quote(ItemStatus.COMPLETED);
  protected static final String DEAD_LETTER = quote(ItemStatus.DEAD_LETTER);
  protected static final String ACTIVE_STATUS_IN = "(" + PENDING + "," + PROCESSING + ")";

  protected static final String ITEM_COLUMNS =
      "id, source, event_type, external_id, payload, status, retry_count, max_retries, " +
      "error_message, created_at, updated_at, processing_started_at, processed_at, " +
      "next_retry_at, worker_id, processing_time_ms, lease_token, lease_expires_at";

  /** Columns cleared whenever an item leaves PROCESSING. */
  protected static final String RELEASE_CLAIM =
      "processing_started_at=NULL, worker_id=NULL, lease_token=NULL, lease_expires_at=NULL";

  protected static final JdbcTemplate.RowMapper<QueueItem> ITEM_ROW_MAPPER = rs -> {
    String workerId = rs.getString("worker_id");
    String leaseToken = rs.getString("lease_token");
    Instant leaseExpiresAt = instant(rs, "lease_expires_at");
    Lease lease = workerId != null && leaseToken != null && leaseExpiresAt != null
        ? new Lease(workerId, leaseToken, leaseExpiresAt)
        : null;
    long processingTime = rs.getLong("processing_time_ms");
    Long processingTimeMs = rs.wasNull() ? null : processingTime;
    return new QueueItem(
        rs.getLong("id"),
        Source.fromDbValue(rs.getString("source")),
        rs.getString("event_type"),
        rs.getString("external_id"),
        rs.getString("payload"),
        ItemStatus.fromDbValue(rs.getString("status")),
        rs.getInt("retry_count"),
        rs.getInt("max_retries"),
        rs.getString("error_message"),
        instant(rs, "created_at"),
        instant(rs, "updated_at"),
        instant(rs, "processing_started_at"),
        instant(rs, "processed_at"),
        instant(rs, "next_retry_at"),
        workerId,
        processingTimeMs,
        lease);
  };

  protected static final Comparator<QueueItem> CLAIM_ORDER =
      Comparator.comparing(QueueItem::createdAt).thenComparingLong(QueueItem::id);

  private final String tableName;

  protected AbstractJdbcQueueStore() {
    this(TableNames.DEFAULT_QUEUE_TABLE);
  }

  protected AbstractJdbcQueueStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  /**
   * Returns a store of the same dialect over a different table.
   */
  public abstract AbstractJdbcQueueStore withTableName(String tableName);

  protected String tableName() {
    return tableName;
  }

  @Override
  public long insert(Connection conn, QueueEvent event, Instant now) {
    String sql = "INSERT INTO " + tableName() + " (" +
        "source, event_type, external_id, payload, status, retry_count, max_retries, " +
        "created_at, updated_at) VALUES (?,?,?,?," + PENDING + ",0,?,?,?)";
    return JdbcTemplate.insertReturningKey(conn, sql, "id",
        event.source().dbValue(), event.eventType(), event.externalId(), event.payloadJson(),
        event.maxRetries(), timestamp(now), timestamp(now))
        .orElseThrow(() -> new IllegalStateException("Insert affected no rows: " + event));
  }

  /**
   * {@code INSERT ... SELECT ... WHERE NOT EXISTS}. The existence check and the
   * insert are one statement.
   */
  @Override
  public OptionalLong insertIfAbsent(Connection conn, QueueEvent event, Instant now) {
    String sql = "INSERT INTO " + tableName() + " (" +
        "source, event_type, external_id, payload, status, retry_count, max_retries, " +
        "created_at, updated_at) " +
        "SELECT ?, ?, ?, ?, " + PENDING + ", 0, ?, " + timestampParam() + ", " + timestampParam() +
        fromDual() + " WHERE NOT EXISTS (" + activeDuplicateQuery() + ")";
    return JdbcTemplate.insertReturningKey(conn, sql, "id",
        event.source().dbValue(), event.eventType(), event.externalId(), event.payloadJson(),
        event.maxRetries(), timestamp(now), timestamp(now),
        event.source().dbValue(), event.eventType(), event.externalId());
  }

  /**
   * A timestamp parameter in a position where the database cannot infer its
   * type from a column, such as a {@code SELECT} list or a {@code CASE} branch.
   */
  protected String timestampParam() {
    return "CAST(? AS TIMESTAMP)";
  }

  /** Table clause for a {@code SELECT} with a {@code WHERE} but no table; empty by default. */
  protected String fromDual() {
    return "";
  }

  protected String activeDuplicateQuery() {
    return "SELECT 1 FROM " + tableName() +
        " WHERE source=? AND event_type=? AND external_id=? AND status IN " + ACTIVE_STATUS_IN;
  }

  @Override
  public Optional<QueueItem> findById(Connection conn, long id) {
    String sql = "SELECT " + ITEM_COLUMNS + " FROM " + tableName() + " WHERE id=?";
    List<QueueItem> rows = JdbcTemplate.query(conn, sql, ITEM_ROW_MAPPER, id);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  /**
   * Two-phase claim (H2-compatible default): an {@code UPDATE} over a
   * {@code LIMIT}ed subquery stamps a fresh lease token, then a {@code SELECT}
   * reads the rows carrying that token. Must run inside one transaction.
   *
   * <p>A row taken by a concurrent claim fails the outer {@code status}
   * re-check after the other transaction commits and is left out.
   */
  @Override
  public List<QueueItem> claim(Connection conn, String workerId, Source source,
      Instant now, Instant leaseExpiresAt, int limit) {
    String token = newLeaseToken();
    String sql = "UPDATE " + tableName() + " SET " + claimAssignments() +
        " WHERE id IN (SELECT id FROM " + tableName() +
        " WHERE " + eligibleCondition(source) +
        " ORDER BY created_at, id LIMIT ?) AND status=" + PENDING;
    List<Object> params = claimParams(workerId, token, now, leaseExpiresAt);
    params.add(timestamp(now));
    if (source != null) {
      params.add(source.dbValue());
    }
    params.add(limit);
    int updated = JdbcTemplate.update(conn, sql, params.toArray());
    if (updated == 0) {
      return List.of();
    }
    return selectClaimed(conn, token);
  }

  /** SET list shared by every claim strategy. */
  protected String claimAssignments() {
    return "status=" + PROCESSING + ", processing_started_at=?, worker_id=?, lease_token=?, " +
        "lease_expires_at=?, next_retry_at=NULL, updated_at=?";
  }

  /** Parameters for {@link #claimAssignments()}, in order. */
  protected List<Object> claimParams(String workerId, String token, Instant now, Instant leaseExpiresAt) {
    List<Object> params = new ArrayList<>();
    params.add(timestamp(now));
    params.add(workerId);
    params.add(token);
    params.add(timestamp(leaseExpiresAt));
    params.add(timestamp(now));
    return params;
  }

  /**
   * Eligibility predicate. Binds {@code now}, then the source when
   * {@code source} is non-null.
   */
  protected String eligibleCondition(Source source) {
    return "status=" + PENDING + " AND (next_retry_at IS NULL OR next_retry_at <= ?)" +
        (source != null ? " AND source=?" : "");
  }

  /**
   * Selects the rows stamped with {@code leaseToken} by a claim in this
   * transaction. Shared by subclasses that use a two-phase claim.
   */
  protected List<QueueItem> selectClaimed(Connection conn, String leaseToken) {
    String sql = "SELECT " + ITEM_COLUMNS + " FROM " + tableName() +
        " WHERE lease_token=? ORDER BY created_at, id";
    return JdbcTemplate.query(conn, sql, ITEM_ROW_MAPPER, leaseToken);
  }

  protected static String newLeaseToken() {
    return UUID.randomUUID().toString();
  }

  @Override
  public int renewLease(Connection conn, long id, String workerId, Instant now, Instant leaseExpiresAt) {
    String sql = "UPDATE " + tableName() + " SET lease_expires_at=?, updated_at=?" +
        " WHERE id=? AND status=" + PROCESSING + " AND worker_id=?";
    return JdbcTemplate.update(conn, sql, timestamp(leaseExpiresAt), timestamp(now), id, workerId);
  }

  @Override
  public int markCompleted(Connection conn, long id, Long processingTimeMs, Instant now) {
    String sql = "UPDATE " + tableName() + " SET status=" + COMPLETED +
        ", processed_at=?, processing_time_ms=?, next_retry_at=NULL, updated_at=?, " + RELEASE_CLAIM +
        " WHERE id=? AND status<>" + DEAD_LETTER;
    return JdbcTemplate.update(conn, sql, timestamp(now), processingTimeMs, timestamp(now), id);
  }

  @Override
  public Optional<ItemStatus> markFailed(Connection conn, long id, String error, boolean retry,
      BackoffSchedule backoff, Instant now) {
    int updated = retry
        ? JdbcTemplate.update(conn, retryOrDeadLetterSql(backoff), retryOrDeadLetterParams(id, error, backoff, now))
        : JdbcTemplate.update(conn, deadLetterSql(), timestamp(now), error, timestamp(now), id);
    if (updated == 0) {
      return Optional.empty();
    }
    String sql = "SELECT status FROM " + tableName() + " WHERE id=?";
    List<ItemStatus> status = JdbcTemplate.query(conn, sql,
        rs -> ItemStatus.fromDbValue(rs.getString(1)), id);
    return status.isEmpty() ? Optional.empty() : Optional.of(status.get(0));
  }

  /**
   * Single-statement retry decision. {@code retry_count} is assigned last:
   * MySQL evaluates SET assignments left to right, so every earlier CASE must
   * still see the pre-increment count.
   */
  protected String retryOrDeadLetterSql(BackoffSchedule backoff) {
    String canRetry = "retry_count < max_retries";
    return "UPDATE " + tableName() + " SET" +
        " status=CASE WHEN " + canRetry + " THEN " + PENDING + " ELSE " + DEAD_LETTER + " END," +
        " next_retry_at=CASE WHEN " + canRetry + " THEN " + backoffCase(backoff) + " ELSE NULL END," +
        " processed_at=CASE WHEN " + canRetry + " THEN NULL ELSE " + timestampParam() + " END," +
        " error_message=?, updated_at=?, " + RELEASE_CLAIM + "," +
        " retry_count=CASE WHEN " + canRetry + " THEN retry_count + 1 ELSE retry_count END" +
        " WHERE id=? AND status IN " + ACTIVE_STATUS_IN;
  }

  protected Object[] retryOrDeadLetterParams(long id, String error, BackoffSchedule backoff, Instant now) {
    List<Object> params = new ArrayList<>();
    for (Duration step : backoff.steps()) {
      params.add(timestamp(now.plus(step)));
    }
    params.add(timestamp(now));
    params.add(error);
    params.add(timestamp(now));
    params.add(id);
    return params.toArray();
  }

  /**
   * {@code CASE retry_count WHEN 0 THEN ? ... ELSE ? END}, one parameter per
   * backoff step; counts past the table use the last step.
   */
  protected String backoffCase(BackoffSchedule backoff) {
    List<Duration> steps = backoff.steps();
    if (steps.size() == 1) {
      return timestampParam();
    }
    StringBuilder sb = new StringBuilder("CASE retry_count");
    for (int i = 0; i < steps.size() - 1; i++) {
      sb.append(" WHEN ").append(i).append(" THEN ").append(timestampParam());
    }
    return sb.append(" ELSE ").append(timestampParam()).append(" END").toString();
  }

  protected String deadLetterSql() {
    return "UPDATE " + tableName() + " SET status=" + DEAD_LETTER +
        ", processed_at=?, next_retry_at=NULL, error_message=?, updated_at=?, " + RELEASE_CLAIM +
        " WHERE id=? AND status IN " + ACTIVE_STATUS_IN;
  }

  @Override
  public int resetStuck(Connection conn, Instant startedBefore, Instant now) {
    String sql = "UPDATE " + tableName() + " SET status=" + PENDING + ", updated_at=?, " + RELEASE_CLAIM +
        " WHERE status=" + PROCESSING + " AND processing_started_at < ?" +
        " AND (lease_expires_at IS NULL OR lease_expires_at <= ?)";
    return JdbcTemplate.update(conn, sql, timestamp(now), timestamp(startedBefore), timestamp(now));
  }

  @Override
  public int reclaimExpiredLeases(Connection conn, Instant now) {
    String sql = "UPDATE " + tableName() + " SET status=" + PENDING + ", updated_at=?, " + RELEASE_CLAIM +
        " WHERE status=" + PROCESSING + " AND lease_expires_at <= ?";
    return JdbcTemplate.update(conn, sql, timestamp(now), timestamp(now));
  }

  @Override
  public List<QueueHealth> queryHealth(Connection conn, Instant now, Instant stuckBefore) {
    String sql = "SELECT source," +
        " SUM(CASE WHEN status=" + PENDING + " THEN 1 ELSE 0 END) AS pending_count," +
        " SUM(CASE WHEN status=" + PROCESSING + " THEN 1 ELSE 0 END) AS processing_count," +
        " SUM(CASE WHEN status=" + PENDING + " AND retry_count > 0 THEN 1 ELSE 0 END) AS failed_count," +
        " SUM(CASE WHEN status=" + DEAD_LETTER + " THEN 1 ELSE 0 END) AS dead_letter_count," +
        " AVG(CASE WHEN status=" + COMPLETED + " THEN processing_time_ms * 1.0 END) AS avg_processing_ms," +
        " MIN(CASE WHEN status=" + PENDING + " THEN created_at END) AS oldest_pending_at," +
        " SUM(CASE WHEN status=" + PROCESSING + " AND processing_started_at < ?" +
        " AND (lease_expires_at IS NULL OR lease_expires_at <= ?) THEN 1 ELSE 0 END) AS stuck_count," +
        " MAX(CASE WHEN status=" + COMPLETED + " THEN processed_at END) AS last_processed_at" +
        " FROM " + tableName() + " GROUP BY source ORDER BY source";
    return JdbcTemplate.query(conn, sql, rs -> mapHealth(rs, now), timestamp(stuckBefore), timestamp(now));
  }

  private static QueueHealth mapHealth(ResultSet rs, Instant now) throws SQLException {
    double avg = rs.getDouble("avg_processing_ms");
    Double avgProcessingMs = rs.wasNull() ? null : avg;
    Instant oldestPendingAt = instant(rs, "oldest_pending_at");
    Duration oldestPendingAge = null;
    if (oldestPendingAt != null) {
      Duration age = Duration.between(oldestPendingAt, now);
      oldestPendingAge = age.isNegative() ? Duration.ZERO : age;
    }
    return new QueueHealth(
        Source.fromDbValue(rs.getString("source")),
        rs.getLong("pending_count"),
        rs.getLong("processing_count"),
        rs.getLong("failed_count"),
        rs.getLong("dead_letter_count"),
        avgProcessingMs,
        oldestPendingAge,
        rs.getLong("stuck_count"),
        instant(rs, "last_processed_at"));
  }

  @Override
  public List<RecentError> queryRecentErrors(Connection conn, Instant since, int limit) {
    String sql = "SELECT id, source, event_type, external_id, status, error_message, retry_count," +
        " created_at, updated_at FROM " + tableName() +
        " WHERE (status=" + DEAD_LETTER + " OR (status=" + PENDING + " AND retry_count > 0))" +
        " AND updated_at >= ? ORDER BY updated_at DESC, id DESC LIMIT ?";
    return JdbcTemplate.query(conn, sql, rs -> new RecentError(
        rs.getLong("id"),
        Source.fromDbValue(rs.getString("source")),
        rs.getString("event_type"),
        rs.getString("external_id"),
        ItemStatus.fromDbValue(rs.getString("status")),
        rs.getString("error_message"),
        rs.getInt("retry_count"),
        instant(rs, "created_at"),
        instant(rs, "updated_at")), timestamp(since), limit);
  }

  @Override
  public List<QueueItem> queryDeadLetters(Connection conn, Source source, int limit) {
    String sql = "SELECT " + ITEM_COLUMNS + " FROM " + tableName() +
        " WHERE status=" + DEAD_LETTER + (source != null ? " AND source=?" : "") +
        " ORDER BY created_at, id LIMIT ?";
    return source != null
        ? JdbcTemplate.query(conn, sql, ITEM_ROW_MAPPER, source.dbValue(), limit)
        : JdbcTemplate.query(conn, sql, ITEM_ROW_MAPPER, limit);
  }

  @Override
  public long countDeadLetters(Connection conn, Source source) {
    String sql = "SELECT COUNT(*) FROM " + tableName() +
        " WHERE status=" + DEAD_LETTER + (source != null ? " AND source=?" : "");
    return source != null
        ? JdbcTemplate.queryForLong(conn, sql, source.dbValue())
        : JdbcTemplate.queryForLong(conn, sql);
  }

  private static String quote(ItemStatus status) {
    return "'" + status.dbValue() + "'";
  }
}
