/**
 * Service provider interfaces for pluggable store access, retention, schema checks and metrics.
 *
 * @see opsaudit.spi.InteractionStore
 * @see opsaudit.spi.MetricsExporter
 */
package opsaudit.spi;
