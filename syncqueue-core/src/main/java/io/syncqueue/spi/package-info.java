/**
 * Service provider interfaces implemented by storage and metrics modules.
 *
 * <ul>
 *   <li>{@link io.syncqueue.spi.QueueStore}: queue rows and their state machine</li>
 *   <li>{@link io.syncqueue.spi.CheckpointStore}: per-source resume positions</li>
 *   <li>{@link io.syncqueue.spi.ItemPurger}: retention deletes</li>
 *   <li>{@link io.syncqueue.spi.ConnectionProvider}: JDBC connections</li>
 *   <li>{@link io.syncqueue.spi.MetricsExporter}: counters and gauges</li>
 * </ul>
 */
package io.syncqueue.spi;
