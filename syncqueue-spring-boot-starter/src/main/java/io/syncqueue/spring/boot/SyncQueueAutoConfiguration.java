package io.syncqueue.spring.boot;

import io.syncqueue.SyncQueue;
import io.syncqueue.maintenance.RetentionSweeper;
import io.syncqueue.maintenance.StuckItemReclaimer;
import io.syncqueue.jdbc.DataSourceConnectionProvider;
import io.syncqueue.jdbc.TableNames;
import io.syncqueue.jdbc.checkpoint.AbstractJdbcCheckpointStore;
import io.syncqueue.jdbc.checkpoint.JdbcCheckpointStores;
import io.syncqueue.jdbc.purge.AbstractJdbcItemPurger;
import io.syncqueue.jdbc.purge.JdbcItemPurgers;
import io.syncqueue.jdbc.store.AbstractJdbcQueueStore;
import io.syncqueue.jdbc.store.JdbcQueueStores;
import io.syncqueue.retry.BackoffSchedule;
import io.syncqueue.spi.CheckpointStore;
import io.syncqueue.spi.ConnectionProvider;
import io.syncqueue.spi.ItemPurger;
import io.syncqueue.spi.MetricsExporter;
import io.syncqueue.spi.QueueStore;
import io.syncqueue.worker.QueueItemHandler;
import io.syncqueue.worker.QueueWorker;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the sync queue.
 *
 * <p>Detects the database dialect from the {@link DataSource}, creates the
 * stores for the configured table names and wires them into a {@link SyncQueue}.
 * The stuck-item reclaimer and retention sweeper are started unless disabled.
 * A {@link QueueWorker} is started only when the application defines a
 * {@link QueueItemHandler} bean.
 *
 * @see SyncQueueProperties
 * @see SyncQueueMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(SyncQueue.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(SyncQueueProperties.class)
public class SyncQueueAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(QueueStore.class)
  public AbstractJdbcQueueStore queueStore(DataSource dataSource, SyncQueueProperties props) {
    AbstractJdbcQueueStore detected = JdbcQueueStores.detect(dataSource);
    if (!TableNames.DEFAULT_QUEUE_TABLE.equals(props.getQueueTable())) {
      return detected.withTableName(props.getQueueTable());
    }
    return detected;
  }

  @Bean
  @ConditionalOnMissingBean(CheckpointStore.class)
  public AbstractJdbcCheckpointStore checkpointStore(DataSource dataSource, SyncQueueProperties props) {
    AbstractJdbcCheckpointStore detected = JdbcCheckpointStores.detect(dataSource);
    if (!TableNames.DEFAULT_CHECKPOINT_TABLE.equals(props.getCheckpointTable())) {
      return detected.withTableName(props.getCheckpointTable());
    }
    return detected;
  }

  @Bean
  @ConditionalOnMissingBean(ItemPurger.class)
  public AbstractJdbcItemPurger itemPurger(DataSource dataSource, SyncQueueProperties props) {
    AbstractJdbcItemPurger detected = JdbcItemPurgers.detect(dataSource);
    if (!TableNames.DEFAULT_QUEUE_TABLE.equals(props.getQueueTable())) {
      return detected.withTableName(props.getQueueTable());
    }
    return detected;
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public SyncQueue syncQueue(SyncQueueProperties props,
      ConnectionProvider connectionProvider,
      QueueStore queueStore,
      CheckpointStore checkpointStore,
      ItemPurger itemPurger,
      ObjectProvider<MetricsExporter> metricsProvider) {
    var builder = SyncQueue.builder()
        .connectionProvider(connectionProvider)
        .queueStore(queueStore)
        .checkpointStore(checkpointStore)
        .purger(itemPurger)
        .backoffSchedule(BackoffSchedule.of(props.getBackoff().getSteps()))
        .leaseDuration(props.getLease().getDuration())
        .stuckThreshold(props.getReclaim().getThreshold());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "syncqueue.reclaim", name = "enabled", matchIfMissing = true)
  public StuckItemReclaimer stuckItemReclaimer(SyncQueue syncQueue, SyncQueueProperties props) {
    return StuckItemReclaimer.builder()
        .syncQueue(syncQueue)
        .stuckThreshold(props.getReclaim().getThreshold())
        .intervalSeconds(props.getReclaim().getIntervalSeconds())
        .build();
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "syncqueue.retention", name = "enabled", matchIfMissing = true)
  public RetentionSweeper retentionSweeper(SyncQueue syncQueue, SyncQueueProperties props) {
    return RetentionSweeper.builder()
        .syncQueue(syncQueue)
        .retention(props.getRetention().getPeriod())
        .batchSize(props.getRetention().getBatchSize())
        .intervalSeconds(props.getRetention().getIntervalSeconds())
        .build();
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnBean(QueueItemHandler.class)
  @ConditionalOnProperty(prefix = "syncqueue.worker", name = "enabled", matchIfMissing = true)
  public QueueWorker queueWorker(SyncQueue syncQueue, QueueItemHandler handler, SyncQueueProperties props) {
    SyncQueueProperties.Worker worker = props.getWorker();
    return QueueWorker.builder()
        .syncQueue(syncQueue)
        .handler(handler)
        .source(worker.getSource())
        .workerIdPrefix(worker.getWorkerIdPrefix())
        .batchSize(worker.getBatchSize())
        .intervalMs(worker.getIntervalMs())
        .concurrency(worker.getConcurrency())
        .build();
  }
}
