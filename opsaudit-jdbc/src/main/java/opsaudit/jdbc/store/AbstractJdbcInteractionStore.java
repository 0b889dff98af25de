package opsaudit.jdbc.store;

import opsaudit.InteractionRecord;
import opsaudit.ToolCallRecord;
import opsaudit.jdbc.AuditStoreException;
import opsaudit.jdbc.JdbcTemplate;
import opsaudit.jdbc.TableNames;
import opsaudit.spi.InteractionStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Base JDBC interaction store with standard SQL for the five audit tables.
 *
 * <p>Subclasses override {@link #insertSessionSql()} where the database offers an
 * insert-if-absent form. Without one, {@link #insertSession} runs the plain insert under a
 * savepoint: when another transaction wrote the same session first, the conflict is rolled
 * back to the savepoint and the insert is retried until that session row becomes visible.
 * Register custom implementations via
 * {@code META-INF/services/opsaudit.jdbc.store.AbstractJdbcInteractionStore}.
 *
 * @see JdbcInteractionStores
 */
public abstract class AbstractJdbcInteractionStore implements InteractionStore {
  private static final String UNIQUE_VIOLATION = "23505";
  // org.h2.api.ErrorCode.CONCURRENT_UPDATE_1: the other row is not committed yet
  private static final int H2_CONCURRENT_UPDATE = 90131;
  private static final int MAX_SESSION_ATTEMPTS = 10;
  private static final long SESSION_RETRY_BACKOFF_MS = 10;

  /**
   * Unique identifier for this store (e.g., "postgresql", "h2"). Also names the schema
   * resource used by {@link opsaudit.jdbc.schema.SchemaProvisioner}.
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:postgresql:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * SQL inserting a session row, parameters {@code session_id, user_id, client_ip,
   * user_agent, created_at}. The default is a plain insert, made race-safe by
   * {@link #insertSession}.
   */
  protected String insertSessionSql() {
    return "INSERT INTO " + TableNames.SESSIONS
        + " (session_id, user_id, client_ip, user_agent, created_at) VALUES (?,?,?,?,?)";
  }

  @Override
  public boolean sessionExists(Connection conn, UUID sessionId) {
    return JdbcTemplate.exists(conn,
        "SELECT 1 FROM " + TableNames.SESSIONS + " WHERE session_id=?", sessionId);
  }

  @Override
  public void insertSession(Connection conn, InteractionRecord record, Instant createdAt) {
    for (int attempt = 1; ; attempt++) {
      Savepoint savepoint = setSavepoint(conn);
      try {
        writeSession(conn, record, createdAt);
        releaseSavepoint(conn, savepoint);
        return;
      } catch (AuditStoreException e) {
        if (attempt >= MAX_SESSION_ATTEMPTS || !isSessionConflict(e.getCause())) {
          throw e;
        }
        rollbackTo(conn, savepoint, e);
      }
      backOff(attempt);
      if (sessionExists(conn, record.sessionId())) {
        return;
      }
    }
  }

  /** Runs {@link #insertSessionSql()} once, without conflict handling. */
  protected void writeSession(Connection conn, InteractionRecord record, Instant createdAt) {
    JdbcTemplate.update(conn, insertSessionSql(),
        record.sessionId(), record.userId(), record.clientIp(), record.userAgent(),
        Timestamp.from(createdAt));
  }

  /**
   * Whether a failed session insert lost a race against another transaction writing the same
   * session, as opposed to failing for any other reason.
   */
  protected boolean isSessionConflict(Throwable cause) {
    if (!(cause instanceof SQLException e)) {
      return false;
    }
    return UNIQUE_VIOLATION.equals(e.getSQLState()) || e.getErrorCode() == H2_CONCURRENT_UPDATE;
  }

  @Override
  public void insertInteraction(Connection conn, InteractionRecord record, Instant createdAt) {
    String sql = "INSERT INTO " + TableNames.INTERACTIONS + " ("
        + "interaction_id, session_id, question, model_name, provider, base_url, cluster, "
        + "final_answer, status, created_at, total_duration_ms, assistant_duration_ms, parse_duration_ms"
        + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        record.interactionId(), record.sessionId(), record.question(), record.modelName(),
        record.provider(), record.baseUrl(), record.cluster(), record.finalAnswer(),
        record.status(), Timestamp.from(createdAt),
        millis(record.totalDuration()), millis(record.assistantDuration()),
        millis(record.parseDuration()));
  }

  @Override
  public void insertThought(Connection conn, InteractionRecord record, Instant createdAt) {
    JdbcTemplate.update(conn,
        "INSERT INTO " + TableNames.THOUGHTS + " (interaction_id, thought, created_at) VALUES (?,?,?)",
        record.interactionId(), record.thought(), Timestamp.from(createdAt));
  }

  @Override
  public void insertToolCalls(Connection conn, InteractionRecord record, Instant createdAt) {
    String sql = "INSERT INTO " + TableNames.TOOL_CALLS + " ("
        + "interaction_id, tool_name, tool_input, tool_observation, sequence_number, duration_ms, created_at"
        + ") VALUES (?,?,?,?,?,?,?)";
    Timestamp ts = Timestamp.from(createdAt);
    List<Object[]> rows = new ArrayList<>(record.toolCalls().size());
    for (ToolCallRecord call : record.toolCalls()) {
      rows.add(new Object[]{record.interactionId(), call.toolName(), call.input(),
          call.observation(), call.sequenceNumber(), millis(call.duration()), ts});
    }
    JdbcTemplate.batchUpdate(conn, sql, rows);
  }

  @Override
  public void insertMetrics(Connection conn, InteractionRecord record, Instant createdAt) {
    String sql = "INSERT INTO " + TableNames.PERFORMANCE_METRICS
        + " (interaction_id, metric_name, duration_ms, created_at) VALUES (?,?,?,?)";
    Timestamp ts = Timestamp.from(createdAt);
    List<Object[]> rows = new ArrayList<>(record.metrics().size());
    for (Map.Entry<String, Duration> metric : record.metrics().entrySet()) {
      rows.add(new Object[]{record.interactionId(), metric.getKey(), millis(metric.getValue()), ts});
    }
    JdbcTemplate.batchUpdate(conn, sql, rows);
  }

  private static Savepoint setSavepoint(Connection conn) {
    try {
      return conn.setSavepoint();
    } catch (SQLException e) {
      throw new AuditStoreException("Failed to set savepoint", e);
    }
  }

  private static void releaseSavepoint(Connection conn, Savepoint savepoint) {
    try {
      conn.releaseSavepoint(savepoint);
    } catch (SQLException e) {
      throw new AuditStoreException("Failed to release savepoint", e);
    }
  }

  private static void rollbackTo(Connection conn, Savepoint savepoint, AuditStoreException failure) {
    try {
      conn.rollback(savepoint);
    } catch (SQLException e) {
      failure.addSuppressed(e);
      throw failure;
    }
  }

  private static void backOff(int attempt) {
    try {
      Thread.sleep(SESSION_RETRY_BACKOFF_MS * attempt);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AuditStoreException("Interrupted while waiting for a concurrent session insert", e);
    }
  }

  /** Whole milliseconds, capped to the range of the INTEGER columns. */
  protected static int millis(Duration duration) {
    long ms = duration.toMillis();
    return ms > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) ms;
  }
}
