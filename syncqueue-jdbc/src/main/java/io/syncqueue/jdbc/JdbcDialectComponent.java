package io.syncqueue.jdbc;

import java.util.List;

/**
 * A JDBC component with database-specific SQL, selectable by JDBC URL.
 *
 * @see JdbcRegistry
 */
public interface JdbcDialectComponent {

  /**
   * Unique identifier (e.g., "mysql", "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this component handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  List<String> jdbcUrlPrefixes();
}
