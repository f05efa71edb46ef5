package io.syncqueue.jdbc.store;

import java.util.List;

/**
 * H2 queue store. Primarily for testing.
 *
 * <p>Uses the default subquery-based two-phase claim from {@link AbstractJdbcQueueStore}.
 * H2 waits on a row locked by a concurrent claim instead of skipping it, so
 * claims serialize under contention but never return the same row twice.
 */
public final class H2QueueStore extends AbstractJdbcQueueStore {

  public H2QueueStore() {
    super();
  }

  public H2QueueStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcQueueStore withTableName(String tableName) {
    return new H2QueueStore(tableName);
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
