/**
 * Read-only queue health, recent error and sync status views.
 */
package io.syncqueue.health;
