package io.syncqueue.jdbc;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ServiceLoader}-backed lookup of {@link JdbcDialectComponent}s by name
 * or JDBC URL.
 *
 * @param <T> the component type, also the service type listed under
 *            {@code META-INF/services}
 */
public final class JdbcRegistry<T extends JdbcDialectComponent> {
  private final String kind;
  private final List<T> components;
  private final Map<String, T> byName = new ConcurrentHashMap<>();

  public JdbcRegistry(Class<T> type, String kind) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.components = ServiceLoader.load(type, type.getClassLoader())
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();
    for (T component : components) {
      byName.put(component.name().toLowerCase(Locale.ROOT), component);
    }
  }

  public List<T> all() {
    return components;
  }

  /**
   * @throws IllegalArgumentException if nothing is registered under {@code name}
   */
  public T get(String name) {
    Objects.requireNonNull(name, "name");
    T component = byName.get(name.toLowerCase(Locale.ROOT));
    if (component == null) {
      throw new IllegalArgumentException("Unknown " + kind + ": " + name +
          ". Available: " + byName.keySet());
    }
    return component;
  }

  /**
   * @throws IllegalStateException if the URL cannot be read from the DataSource
   * @throws IllegalArgumentException if no component matches the URL
   */
  public T detect(DataSource dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    try (Connection conn = dataSource.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect " + kind + " from DataSource", e);
    }
  }

  /**
   * @throws IllegalArgumentException if no component matches the URL
   */
  public T detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    for (T component : components) {
      for (String prefix : component.jdbcUrlPrefixes()) {
        if (url.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return component;
        }
      }
    }
    throw new IllegalArgumentException("No " + kind + " found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + components.stream()
            .flatMap(c -> c.jdbcUrlPrefixes().stream())
            .toList());
  }
}
