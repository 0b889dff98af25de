package opsaudit.pipeline;

import opsaudit.InteractionRecord;
import opsaudit.spi.ConnectionProvider;
import opsaudit.spi.InteractionStore;
import opsaudit.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes one batch of records as a single all-or-nothing transaction.
 *
 * <p>For each record, in order: the session row if it does not exist yet, the interaction
 * row, the thought (if any), the tool calls and the performance metrics. Any failure rolls
 * the whole batch back; its records are discarded, never retried or re-queued.
 */
public final class BatchFlusher {
  private final ConnectionProvider connectionProvider;
  private final InteractionStore store;
  private final Clock clock;
  private final MetricsExporter metrics;
  private final Logger logger;

  public BatchFlusher(ConnectionProvider connectionProvider, InteractionStore store,
      Clock clock, MetricsExporter metrics, Logger logger) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(store, "store");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.logger = Objects.requireNonNull(logger, "logger");
  }

  /**
   * Persists {@code batch} in one transaction.
   *
   * @param batch records to write, in submission order
   * @return {@code true} if the batch was committed
   */
  public boolean flush(List<InteractionRecord> batch) {
    if (batch.isEmpty()) {
      return true;
    }
    int size = batch.size();
    Instant createdAt = clock.instant();
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      InteractionRecord current = null;
      try {
        for (InteractionRecord record : batch) {
          current = record;
          write(conn, record, createdAt);
        }
        current = null;
        conn.commit();
      } catch (SQLException | RuntimeException e) {
        rollback(conn, e);
        logFailure(current, size, e);
        metrics.incrementBatchFailed(size);
        return false;
      }
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Cannot obtain audit store connection; discarded batch of " + size, e);
      metrics.incrementBatchFailed(size);
      return false;
    }
    metrics.incrementBatchCommitted(size);
    logger.log(Level.FINE, "Committed audit batch of {0}", size);
    return true;
  }

  private void write(Connection conn, InteractionRecord record, Instant createdAt) {
    if (!store.sessionExists(conn, record.sessionId())) {
      store.insertSession(conn, record, createdAt);
    }
    store.insertInteraction(conn, record, createdAt);
    if (record.hasThought()) {
      store.insertThought(conn, record, createdAt);
    }
    if (!record.toolCalls().isEmpty()) {
      store.insertToolCalls(conn, record, createdAt);
    }
    if (!record.metrics().isEmpty()) {
      store.insertMetrics(conn, record, createdAt);
    }
  }

  private void logFailure(InteractionRecord current, int size, Exception e) {
    if (current == null) {
      logger.log(Level.SEVERE, "Audit batch commit failed; discarded batch of " + size, e);
    } else {
      logger.log(Level.SEVERE, "Audit batch rolled back at interactionId=" + current.interactionId()
          + ", sessionId=" + current.sessionId() + "; discarded batch of " + size, e);
    }
  }

  private static void rollback(Connection conn, Exception failure) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      failure.addSuppressed(e);
    }
  }
}
