/**
 * JDBC retention purge.
 */
package opsaudit.jdbc.purge;
