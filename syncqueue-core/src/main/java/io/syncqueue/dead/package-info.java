/**
 * Operator visibility into dead-lettered items.
 */
package io.syncqueue.dead;
