/**
 * JDBC {@link opsaudit.spi.InteractionStore} implementations, discovered by JDBC URL through
 * {@link opsaudit.jdbc.store.JdbcInteractionStores}.
 */
package opsaudit.jdbc.store;
