package opsaudit.jdbc.purge;

import opsaudit.jdbc.JdbcTemplate;
import opsaudit.jdbc.TableNames;
import opsaudit.spi.InteractionPurger;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * JDBC interaction purger using standard SQL that works for PostgreSQL and H2.
 *
 * <p>Selects the ids of interactions created before the cutoff, then deletes their metrics,
 * tool calls, thoughts and finally the interactions themselves, in {@code IN} lists of at most
 * {@value #DEFAULT_CHUNK_SIZE} ids. All deletes run on the caller's transaction.
 */
public class JdbcInteractionPurger implements InteractionPurger {
  public static final int DEFAULT_CHUNK_SIZE = 500;

  private final int chunkSize;

  public JdbcInteractionPurger() {
    this(DEFAULT_CHUNK_SIZE);
  }

  public JdbcInteractionPurger(int chunkSize) {
    if (chunkSize < 1) {
      throw new IllegalArgumentException("chunkSize must be >= 1");
    }
    this.chunkSize = chunkSize;
  }

  @Override
  public int purge(Connection conn, Instant before) {
    List<UUID> expired = JdbcTemplate.query(conn,
        "SELECT interaction_id FROM " + TableNames.INTERACTIONS + " WHERE created_at < ?",
        rs -> rs.getObject(1, UUID.class),
        Timestamp.from(before));
    for (int from = 0; from < expired.size(); from += chunkSize) {
      List<UUID> chunk = expired.subList(from, Math.min(from + chunkSize, expired.size()));
      String in = String.join(",", Collections.nCopies(chunk.size(), "?"));
      Object[] ids = chunk.toArray();
      for (String table : TableNames.PURGE_ORDER) {
        JdbcTemplate.update(conn, "DELETE FROM " + table + " WHERE interaction_id IN (" + in + ")", ids);
      }
    }
    return expired.size();
  }
}
