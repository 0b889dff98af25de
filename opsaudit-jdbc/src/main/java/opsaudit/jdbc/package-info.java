/**
 * JDBC implementations of the audit SPIs together with connection settings, the canonical JDBC
 * URL builder, the HikariCP pool factory and the {@link opsaudit.jdbc.JdbcAudit} bootstrap.
 *
 * @see opsaudit.jdbc.store.JdbcInteractionStores
 */
package opsaudit.jdbc;
