package io.syncqueue.jdbc.checkpoint;

import io.syncqueue.jdbc.JdbcDialectComponent;
import io.syncqueue.jdbc.JdbcTemplate;
import io.syncqueue.jdbc.TableNames;
import io.syncqueue.model.Checkpoint;
import io.syncqueue.model.Source;
import io.syncqueue.spi.CheckpointStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static io.syncqueue.jdbc.JdbcTemplate.instant;
import static io.syncqueue.jdbc.JdbcTemplate.timestamp;

/**
 * Base JDBC checkpoint store. Writes use a standard SQL {@code MERGE}, which
 * H2 supports; PostgreSQL and MySQL override them with their native upserts.
 *
 * <p>Register custom implementations via
 * {@code META-INF/services/io.syncqueue.jdbc.checkpoint.AbstractJdbcCheckpointStore}.
 *
 * @see JdbcCheckpointStores
 */
public abstract class AbstractJdbcCheckpointStore implements CheckpointStore, JdbcDialectComponent {

  protected static final String CHECKPOINT_COLUMNS = "source, last_event_time, last_cursor, updated_at";

  protected static final JdbcTemplate.RowMapper<Checkpoint> CHECKPOINT_ROW_MAPPER = rs -> new Checkpoint(
      Source.fromDbValue(rs.getString("source")),
      instant(rs, "last_event_time"),
      rs.getString("last_cursor"),
      instant(rs, "updated_at"));

  private final String tableName;

  protected AbstractJdbcCheckpointStore() {
    this(TableNames.DEFAULT_CHECKPOINT_TABLE);
  }

  protected AbstractJdbcCheckpointStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  /**
   * Returns a store of the same dialect over a different table.
   */
  public abstract AbstractJdbcCheckpointStore withTableName(String tableName);

  protected String tableName() {
    return tableName;
  }

  @Override
  public Optional<Checkpoint> find(Connection conn, Source source) {
    String sql = "SELECT " + CHECKPOINT_COLUMNS + " FROM " + tableName() + " WHERE source=?";
    List<Checkpoint> rows = JdbcTemplate.query(conn, sql, CHECKPOINT_ROW_MAPPER, source.dbValue());
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public List<Checkpoint> findAll(Connection conn) {
    String sql = "SELECT " + CHECKPOINT_COLUMNS + " FROM " + tableName() + " ORDER BY source";
    return JdbcTemplate.query(conn, sql, CHECKPOINT_ROW_MAPPER);
  }

  @Override
  public void upsert(Connection conn, Source source, Instant lastEventTime, String lastCursor, Instant now) {
    String sql = "MERGE INTO " + tableName() + " t USING (VALUES (" +
        "CAST(? AS VARCHAR(20)), CAST(? AS TIMESTAMP), CAST(? AS VARCHAR), CAST(? AS TIMESTAMP)" +
        ")) s(source, last_event_time, last_cursor, updated_at) ON t.source = s.source" +
        " WHEN MATCHED THEN UPDATE SET last_event_time = s.last_event_time," +
        " last_cursor = s.last_cursor, updated_at = s.updated_at" +
        " WHEN NOT MATCHED THEN INSERT (" + CHECKPOINT_COLUMNS + ")" +
        " VALUES (s.source, s.last_event_time, s.last_cursor, s.updated_at)";
    JdbcTemplate.update(conn, sql, source.dbValue(), timestamp(lastEventTime), lastCursor, timestamp(now));
  }

  @Override
  public void touch(Connection conn, Source source, Instant now) {
    String sql = "MERGE INTO " + tableName() + " t USING (VALUES (" +
        "CAST(? AS VARCHAR(20)), CAST(? AS TIMESTAMP)" +
        ")) s(source, updated_at) ON t.source = s.source" +
        " WHEN MATCHED THEN UPDATE SET updated_at = s.updated_at" +
        " WHEN NOT MATCHED THEN INSERT (" + CHECKPOINT_COLUMNS + ")" +
        " VALUES (s.source, CAST(? AS TIMESTAMP), NULL, s.updated_at)";
    JdbcTemplate.update(conn, sql, source.dbValue(), timestamp(now), timestamp(Instant.EPOCH));
  }
}
