/**
 * Audit pipeline for operations-assistant interactions: the record model, the
 * {@link opsaudit.AuditPipeline} ingestion interface and its start-up entry point
 * {@link opsaudit.AuditPipelines}.
 */
package opsaudit;
