/**
 * Micrometer metrics integration.
 *
 * @see io.syncqueue.micrometer.MicrometerMetricsExporter
 */
package io.syncqueue.micrometer;
