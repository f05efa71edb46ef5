package io.syncqueue.jdbc;

import java.util.Objects;

/**
 * Shared table name validation for JDBC components. Table names are
 * concatenated into SQL, so only plain identifiers are accepted.
 */
public final class TableNames {
  public static final String DEFAULT_QUEUE_TABLE = "sync_queue_item";
  public static final String DEFAULT_CHECKPOINT_TABLE = "sync_checkpoint";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
