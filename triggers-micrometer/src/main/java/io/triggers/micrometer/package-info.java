/**
 * Micrometer integration for trigger dispatch metrics.
 *
 * @see io.triggers.micrometer.MicrometerMetricsExporter
 */
package io.triggers.micrometer;
