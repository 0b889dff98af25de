package opsaudit.spi;

import opsaudit.StoreUnavailableException;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Start-up check that the store is reachable and holds the expected schema.
 *
 * <p>A verifier never creates anything. Schema provisioning is a separate, explicit step.
 *
 * @see opsaudit.jdbc.schema.JdbcSchemaVerifier
 */
@FunctionalInterface
public interface SchemaVerifier {

  /** Only checks that the connection is alive. */
  SchemaVerifier CONNECTIVITY = conn -> {
    if (!conn.isValid(10)) {
      throw new StoreUnavailableException("Audit store connection is not valid");
    }
  };

  /**
   * Verifies the store behind {@code conn}.
   *
   * @param conn a fresh connection
   * @throws StoreUnavailableException if the store cannot be used
   * @throws SQLException if the check itself fails
   */
  void verify(Connection conn) throws SQLException;
}
