package opsaudit.spi;

import opsaudit.InteractionRecord;

import java.sql.Connection;
import java.time.Instant;
import java.util.UUID;

/**
 * Row-level persistence operations for audit records.
 *
 * <p>Every method runs on the caller's connection and never commits; the
 * {@link opsaudit.pipeline.BatchFlusher} owns the transaction boundary. Rows are append-only:
 * there is deliberately no update operation. Implementations report SQL failures as unchecked
 * exceptions so that the flusher can roll back the whole batch.
 *
 * @see opsaudit.jdbc.store.AbstractJdbcInteractionStore
 */
public interface InteractionStore {

  /**
   * Returns {@code true} if a row for the given session already exists.
   *
   * @param conn      the transaction's connection
   * @param sessionId the session to look up
   * @return whether the session row exists
   */
  boolean sessionExists(Connection conn, UUID sessionId);

  /**
   * Inserts the session row of {@code record} unless one already exists. Must tolerate a
   * concurrent insert of the same session from another transaction.
   *
   * @param conn      the transaction's connection
   * @param record    the record whose session columns are written
   * @param createdAt timestamp shared by every row of the flush
   */
  void insertSession(Connection conn, InteractionRecord record, Instant createdAt);

  /**
   * Inserts the interaction row.
   *
   * @param conn      the transaction's connection
   * @param record    the record to write
   * @param createdAt timestamp shared by every row of the flush
   */
  void insertInteraction(Connection conn, InteractionRecord record, Instant createdAt);

  /**
   * Inserts the thought row. Only called when the record carries a non-empty thought.
   *
   * @param conn      the transaction's connection
   * @param record    the record to write
   * @param createdAt timestamp shared by every row of the flush
   */
  void insertThought(Connection conn, InteractionRecord record, Instant createdAt);

  /**
   * Inserts one row per tool call, keeping each call's sequence number.
   *
   * @param conn      the transaction's connection
   * @param record    the record to write
   * @param createdAt timestamp shared by every row of the flush
   */
  void insertToolCalls(Connection conn, InteractionRecord record, Instant createdAt);

  /**
   * Inserts one row per performance metric.
   *
   * @param conn      the transaction's connection
   * @param record    the record to write
   * @param createdAt timestamp shared by every row of the flush
   */
  void insertMetrics(Connection conn, InteractionRecord record, Instant createdAt);
}
