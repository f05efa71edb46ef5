package io.syncqueue.worker;

import io.syncqueue.model.QueueItem;

/**
 * Processes one claimed queue item on a {@link QueueWorker} thread.
 *
 * <h2>Error Handling</h2>
 * <ul>
 *   <li>Normal return marks the item COMPLETED with the measured processing time</li>
 *   <li>{@link NonRetryableException} dead-letters the item immediately</li>
 *   <li>Any other exception schedules a retry with backoff; once the retry
 *       budget is spent the item is dead-lettered</li>
 * </ul>
 *
 * <h2>Idempotency</h2>
 * <p>Items may be handed out more than once: after a crash, after a lease
 * expires, or after an enqueue duplicate. Writes made here must be idempotent,
 * typically keyed by {@link QueueItem#source()} and {@link QueueItem#externalId()}.
 */
@FunctionalInterface
public interface QueueItemHandler {

  /**
   * @param item the claimed item, in PROCESSING state
   * @throws Exception if processing fails
   */
  void handle(QueueItem item) throws Exception;
}
