package io.syncqueue.jdbc.checkpoint;

import io.syncqueue.jdbc.JdbcTemplate;
import io.syncqueue.model.Source;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

import static io.syncqueue.jdbc.JdbcTemplate.timestamp;

/**
 * MySQL checkpoint store using {@code INSERT ... ON DUPLICATE KEY UPDATE}.
 * Also compatible with TiDB.
 */
public final class MySqlCheckpointStore extends AbstractJdbcCheckpointStore {

  public MySqlCheckpointStore() {
    super();
  }

  public MySqlCheckpointStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcCheckpointStore withTableName(String tableName) {
    return new MySqlCheckpointStore(tableName);
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
  public void upsert(Connection conn, Source source, Instant lastEventTime, String lastCursor, Instant now) {
    String sql = "INSERT INTO " + tableName() + " (" + CHECKPOINT_COLUMNS + ") VALUES (?,?,?,?)" +
        " ON DUPLICATE KEY UPDATE last_event_time = VALUES(last_event_time)," +
        " last_cursor = VALUES(last_cursor), updated_at = VALUES(updated_at)";
    JdbcTemplate.update(conn, sql, source.dbValue(), timestamp(lastEventTime), lastCursor, timestamp(now));
  }

  @Override
  public void touch(Connection conn, Source source, Instant now) {
    String sql = "INSERT INTO " + tableName() + " (" + CHECKPOINT_COLUMNS + ") VALUES (?,?,NULL,?)" +
        " ON DUPLICATE KEY UPDATE updated_at = VALUES(updated_at)";
    JdbcTemplate.update(conn, sql, source.dbValue(), timestamp(Instant.EPOCH), timestamp(now));
  }
}
