/**
 * Polling consumer that routes handler outcomes to completion, retry or
 * dead-letter.
 */
package io.syncqueue.worker;
