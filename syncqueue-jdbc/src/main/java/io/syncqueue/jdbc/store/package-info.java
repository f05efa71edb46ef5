/**
 * Queue item stores. The claim strategy is the main per-database difference.
 */
package io.syncqueue.jdbc.store;
