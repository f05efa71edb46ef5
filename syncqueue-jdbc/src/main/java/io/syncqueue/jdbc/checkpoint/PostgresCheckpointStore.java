package io.syncqueue.jdbc.checkpoint;

import io.syncqueue.jdbc.JdbcTemplate;
import io.syncqueue.model.Source;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

import static io.syncqueue.jdbc.JdbcTemplate.timestamp;

/**
 * PostgreSQL checkpoint store using {@code INSERT ... ON CONFLICT}.
 */
public final class PostgresCheckpointStore extends AbstractJdbcCheckpointStore {

  public PostgresCheckpointStore() {
    super();
  }

  public PostgresCheckpointStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcCheckpointStore withTableName(String tableName) {
    return new PostgresCheckpointStore(tableName);
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
  public void upsert(Connection conn, Source source, Instant lastEventTime, String lastCursor, Instant now) {
    String sql = "INSERT INTO " + tableName() + " (" + CHECKPOINT_COLUMNS + ") VALUES (?,?,?,?)" +
        " ON CONFLICT (source) DO UPDATE SET last_event_time = EXCLUDED.last_event_time," +
        " last_cursor = EXCLUDED.last_cursor, updated_at = EXCLUDED.updated_at";
    JdbcTemplate.update(conn, sql, source.dbValue(), timestamp(lastEventTime), lastCursor, timestamp(now));
  }

  @Override
  public void touch(Connection conn, Source source, Instant now) {
    String sql = "INSERT INTO " + tableName() + " (" + CHECKPOINT_COLUMNS + ") VALUES (?,?,NULL,?)" +
        " ON CONFLICT (source) DO UPDATE SET updated_at = EXCLUDED.updated_at";
    JdbcTemplate.update(conn, sql, source.dbValue(), timestamp(Instant.EPOCH), timestamp(now));
  }
}
