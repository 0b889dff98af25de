package opsaudit.spi;

import java.sql.Connection;
import java.time.Instant;

/**
 * Deletes interactions, and every row that references them, created before a cutoff.
 *
 * <p>Runs on the caller's connection without committing; the
 * {@link opsaudit.retention.RetentionSweeper} wraps the call in a single transaction.
 * Session rows are never deleted.
 *
 * @see opsaudit.jdbc.purge.JdbcInteractionPurger
 */
public interface InteractionPurger {

  /**
   * Removes expired interactions and their thoughts, tool calls and metrics.
   *
   * @param conn   the transaction's connection
   * @param before interactions created strictly before this instant are removed
   * @return the number of interactions removed
   */
  int purge(Connection conn, Instant before);
}
