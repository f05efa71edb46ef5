/**
 * Per-source checkpoint stores.
 */
package io.syncqueue.jdbc.checkpoint;
