package opsaudit.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by the audit store, purger and schema
 * components. A batch flush that meets one rolls back the whole batch.
 */
public final class AuditStoreException extends RuntimeException {
    public AuditStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
