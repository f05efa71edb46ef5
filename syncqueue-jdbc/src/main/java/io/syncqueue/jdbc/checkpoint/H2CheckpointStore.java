package io.syncqueue.jdbc.checkpoint;

import java.util.List;

/**
 * H2 checkpoint store. Uses the standard {@code MERGE} statements from
 * {@link AbstractJdbcCheckpointStore}.
 */
public final class H2CheckpointStore extends AbstractJdbcCheckpointStore {

  public H2CheckpointStore() {
    super();
  }

  public H2CheckpointStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcCheckpointStore withTableName(String tableName) {
    return new H2CheckpointStore(tableName);
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
