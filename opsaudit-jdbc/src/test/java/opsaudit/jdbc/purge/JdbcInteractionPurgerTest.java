package opsaudit.jdbc.purge;

import opsaudit.InteractionIds;
import opsaudit.InteractionRecord;
import opsaudit.jdbc.AuditFixtures;
import opsaudit.jdbc.DataSourceConnectionProvider;
import opsaudit.jdbc.store.H2InteractionStore;
import opsaudit.pipeline.BatchFlusher;
import opsaudit.spi.MetricsExporter;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.logging.Logger;

import static opsaudit.jdbc.AuditFixtures.count;
import static opsaudit.jdbc.AuditFixtures.rows;
import static org.junit.jupiter.api.Assertions.*;

class JdbcInteractionPurgerTest {
  private static final Instant NOW = Instant.parse("2026-03-10T03:00:00Z");

  private JdbcDataSource ds;

  @BeforeEach
  void setup() throws Exception {
    ds = AuditFixtures.newH2WithSchema();
  }

  @Test
  void removesExpiredInteractionsWithChildren() throws Exception {
    UUID sessionId = InteractionIds.newSessionId();
    InteractionRecord old = fullRecord(sessionId);
    InteractionRecord recent = fullRecord(sessionId);
    writeAt(NOW.minus(Duration.ofDays(31)), old);
    writeAt(NOW.minus(Duration.ofDays(10)), recent);

    int removed = purge(new JdbcInteractionPurger(), NOW.minus(Duration.ofDays(30)));

    assertEquals(1, removed);
    assertEquals(0, count(ds, "SELECT COUNT(*) FROM interactions WHERE interaction_id=?", old.interactionId()));
    assertEquals(0, count(ds, "SELECT COUNT(*) FROM thoughts WHERE interaction_id=?", old.interactionId()));
    assertEquals(0, count(ds, "SELECT COUNT(*) FROM tool_calls WHERE interaction_id=?", old.interactionId()));
    assertEquals(0, count(ds, "SELECT COUNT(*) FROM performance_metrics WHERE interaction_id=?", old.interactionId()));

    assertEquals(1, count(ds, "SELECT COUNT(*) FROM interactions WHERE interaction_id=?", recent.interactionId()));
    assertEquals(1, count(ds, "SELECT COUNT(*) FROM thoughts WHERE interaction_id=?", recent.interactionId()));
    assertEquals(1, count(ds, "SELECT COUNT(*) FROM tool_calls WHERE interaction_id=?", recent.interactionId()));
    assertEquals(1, count(ds, "SELECT COUNT(*) FROM performance_metrics WHERE interaction_id=?", recent.interactionId()));
    assertEquals(1, rows(ds, "sessions"));
  }

  @Test
  void cutoffIsExclusive() throws Exception {
    Instant cutoff = NOW.minus(Duration.ofDays(30));
    writeAt(cutoff, fullRecord(InteractionIds.newSessionId()));

    assertEquals(0, purge(new JdbcInteractionPurger(), cutoff));
    assertEquals(1, rows(ds, "interactions"));
  }

  @Test
  void deletesInChunks() throws Exception {
    List<InteractionRecord> batch = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      batch.add(fullRecord(InteractionIds.newSessionId()));
    }
    writeAt(NOW.minus(Duration.ofDays(40)), batch.toArray(new InteractionRecord[0]));

    assertEquals(5, purge(new JdbcInteractionPurger(2), NOW));

    assertEquals(0, rows(ds, "interactions"));
    assertEquals(0, rows(ds, "tool_calls"));
    assertEquals(0, rows(ds, "thoughts"));
    assertEquals(0, rows(ds, "performance_metrics"));
    assertEquals(5, rows(ds, "sessions"));
  }

  @Test
  void emptyStoreRemovesNothing() throws Exception {
    assertEquals(0, purge(new JdbcInteractionPurger(), NOW));
  }

  @Test
  void rejectsNonPositiveChunkSize() {
    assertThrows(IllegalArgumentException.class, () -> new JdbcInteractionPurger(0));
  }

  private int purge(JdbcInteractionPurger purger, Instant before) throws Exception {
    try (Connection conn = ds.getConnection()) {
      conn.setAutoCommit(false);
      int removed = purger.purge(conn, before);
      conn.commit();
      return removed;
    }
  }

  private void writeAt(Instant createdAt, InteractionRecord... records) {
    BatchFlusher flusher = new BatchFlusher(new DataSourceConnectionProvider(ds), new H2InteractionStore(),
        Clock.fixed(createdAt, ZoneOffset.UTC), MetricsExporter.NOOP,
        Logger.getLogger(JdbcInteractionPurgerTest.class.getName()));
    assertTrue(flusher.flush(List.of(records)));
  }

  private static InteractionRecord fullRecord(UUID sessionId) {
    return InteractionRecord.builder(sessionId)
        .question("scale api to 5 replicas")
        .modelName("gpt-4o")
        .status("success")
        .thought("use kubectl scale")
        .addToolCall("kubectl", "scale deploy/api --replicas=5", "scaled", Duration.ofMillis(80))
        .metric("llm_call", Duration.ofMillis(900))
        .build();
  }
}
