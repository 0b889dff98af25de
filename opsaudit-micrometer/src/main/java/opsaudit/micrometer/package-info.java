/**
 * Micrometer bridge for the audit pipeline counters and queue depth.
 *
 * @see opsaudit.micrometer.MicrometerMetricsExporter
 */
package opsaudit.micrometer;
