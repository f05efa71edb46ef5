/**
 * Spring Boot auto-configuration for the sync queue.
 *
 * <p>Add {@code syncqueue-spring-boot-starter} to a Boot application with a
 * {@link javax.sql.DataSource} and the queue wires itself: dialect-specific
 * stores, the {@link io.syncqueue.SyncQueue} facade, the maintenance schedulers,
 * and a {@link io.syncqueue.worker.QueueWorker} when a
 * {@link io.syncqueue.worker.QueueItemHandler} bean is present.
 *
 * @see io.syncqueue.spring.boot.SyncQueueProperties
 */
package io.syncqueue.spring.boot;
