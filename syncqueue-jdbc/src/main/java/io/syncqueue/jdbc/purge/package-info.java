/**
 * Retention deletes of completed queue items.
 */
package io.syncqueue.jdbc.purge;
