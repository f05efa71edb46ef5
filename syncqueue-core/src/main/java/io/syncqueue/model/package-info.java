/**
 * Value types for queue items, checkpoints and the derived health views.
 *
 * @see io.syncqueue.model.QueueItem
 * @see io.syncqueue.model.ItemStatus
 * @see io.syncqueue.model.Checkpoint
 */
package io.syncqueue.model;
