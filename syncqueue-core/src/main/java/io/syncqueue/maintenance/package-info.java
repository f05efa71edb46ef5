/**
 * Background maintenance: crash recovery of abandoned claims and retention of
 * completed items.
 */
package io.syncqueue.maintenance;
