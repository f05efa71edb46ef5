package io.syncqueue.health;

import io.syncqueue.QueueStoreException;
import io.syncqueue.model.Checkpoint;
import io.syncqueue.model.QueueHealth;
import io.syncqueue.model.RecentError;
import io.syncqueue.model.Source;
import io.syncqueue.model.SyncStatus;
import io.syncqueue.spi.CheckpointStore;
import io.syncqueue.spi.ConnectionProvider;
import io.syncqueue.spi.MetricsExporter;
import io.syncqueue.spi.QueueStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only aggregation over the queue and checkpoint stores for operational
 * dashboards. Nothing here mutates state.
 *
 * <p>Every view lists all {@link Source} values in declaration order, with
 * zeroes for sources that have no rows. Each evaluation of
 * {@link #queueHealth()} is also pushed to the {@link MetricsExporter}.
 */
public final class QueueHealthMonitor {
  private final ConnectionProvider connectionProvider;
  private final QueueStore queueStore;
  private final CheckpointStore checkpointStore;
  private final Clock clock;
  private final Duration stuckThreshold;
  private final MetricsExporter metrics;

  public QueueHealthMonitor(ConnectionProvider connectionProvider, QueueStore queueStore,
      CheckpointStore checkpointStore, Clock clock, Duration stuckThreshold, MetricsExporter metrics) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.queueStore = Objects.requireNonNull(queueStore, "queueStore");
    this.checkpointStore = Objects.requireNonNull(checkpointStore, "checkpointStore");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.stuckThreshold = Objects.requireNonNull(stuckThreshold, "stuckThreshold");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  /**
   * Per-source counts and ages. "Failed" counts pending items that are waiting
   * for a retry; "stuck" counts processing items claimed longer ago than the
   * stuck threshold.
   */
  public List<QueueHealth> queueHealth() {
    Instant now = clock.instant();
    List<QueueHealth> result;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      result = zeroFill(queueStore.queryHealth(conn, now, now.minus(stuckThreshold)));
    } catch (SQLException e) {
      throw new QueueStoreException("Failed to query queue health", e);
    }
    for (QueueHealth health : result) {
      metrics.recordHealth(health);
    }
    return result;
  }

  public QueueHealth queueHealth(Source source) {
    Objects.requireNonNull(source, "source");
    for (QueueHealth health : queueHealth()) {
      if (health.source() == source) {
        return health;
      }
    }
    return QueueHealth.empty(source);
  }

  /**
   * Dead-lettered items and items waiting for a retry that were updated within
   * {@code window}, newest first.
   */
  public List<RecentError> recentErrors(Duration window, int limit) {
    Objects.requireNonNull(window, "window");
    if (window.isNegative()) {
      throw new IllegalArgumentException("window must be >= 0");
    }
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    Instant since = clock.instant().minus(window);
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return queueStore.queryRecentErrors(conn, since, limit);
    } catch (SQLException e) {
      throw new QueueStoreException("Failed to query recent errors", e);
    }
  }

  /**
   * Checkpoint position next to queue backlog, per source. Sources without a
   * checkpoint report {@code null} times.
   */
  public List<SyncStatus> syncStatus() {
    Instant now = clock.instant();
    List<QueueHealth> health;
    List<Checkpoint> checkpoints;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      health = zeroFill(queueStore.queryHealth(conn, now, now.minus(stuckThreshold)));
      checkpoints = checkpointStore.findAll(conn);
    } catch (SQLException e) {
      throw new QueueStoreException("Failed to query sync status", e);
    }
    Map<Source, Checkpoint> bySource = new EnumMap<>(Source.class);
    for (Checkpoint checkpoint : checkpoints) {
      bySource.put(checkpoint.source(), checkpoint);
    }
    List<SyncStatus> result = new ArrayList<>(health.size());
    for (QueueHealth h : health) {
      Optional<Checkpoint> checkpoint = Optional.ofNullable(bySource.get(h.source()));
      result.add(new SyncStatus(
          h.source(),
          checkpoint.map(Checkpoint::lastEventTime).orElse(null),
          checkpoint.map(Checkpoint::updatedAt).orElse(null),
          h.pending(),
          h.processing(),
          h.failed(),
          h.lastProcessedAt()));
    }
    return result;
  }

  private static List<QueueHealth> zeroFill(List<QueueHealth> rows) {
    Map<Source, QueueHealth> bySource = new EnumMap<>(Source.class);
    for (QueueHealth row : rows) {
      bySource.put(row.source(), row);
    }
    List<QueueHealth> result = new ArrayList<>(Source.values().length);
    for (Source source : Source.values()) {
      result.add(bySource.getOrDefault(source, QueueHealth.empty(source)));
    }
    return result;
  }
}
