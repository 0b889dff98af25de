package opsaudit.jdbc;

import com.zaxxer.hikari.HikariDataSource;
import opsaudit.AuditConfig;
import opsaudit.AuditPipeline;
import opsaudit.InteractionIds;
import opsaudit.jdbc.purge.JdbcInteractionPurger;
import opsaudit.jdbc.schema.SchemaProvisioner;
import opsaudit.retention.RetentionSweeper;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Connection;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static opsaudit.jdbc.AuditFixtures.rows;
import static org.junit.jupiter.api.Assertions.*;

@DockerAvailable
@Testcontainers
class PostgresIntegrationTest {

  @Container
  private static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine");

  private static DatabaseConfig database() {
    return new DatabaseConfig()
        .setHost(postgres.getHost())
        .setPort(postgres.getMappedPort(PostgreSQLContainer.POSTGRESQL_PORT))
        .setDbName(postgres.getDatabaseName())
        .setUser(postgres.getUsername())
        .setPassword(postgres.getPassword())
        .setMaxOpenConns(6);
  }

  private static HikariDataSource directDataSource() {
    return HikariDataSources.create(postgres.getJdbcUrl(), database());
  }

  @Test
  void concurrentWorkersWriteEachSessionOnce() throws Exception {
    AuditPipeline audit = JdbcAudit.builder()
        .config(new AuditConfig()
            .setEnabled(true)
            .setWorkers(4)
            .setBatchSize(3)
            .setBatchInterval(Duration.ofMillis(50)))
        .database(database())
        .provisionSchema(true)
        .build();
    assertTrue(audit.isEnabled());

    List<UUID> sessions = List.of(InteractionIds.newSessionId(), InteractionIds.newSessionId(),
        InteractionIds.newSessionId());
    ExecutorService executor = Executors.newFixedThreadPool(6);
    List<Future<?>> futures = new ArrayList<>();
    for (int t = 0; t < 6; t++) {
      futures.add(executor.submit(() -> {
        for (int i = 0; i < 20; i++) {
          audit.submit(AuditFixtures.record(sessions.get(i % sessions.size())));
        }
      }));
    }
    for (Future<?> future : futures) {
      future.get(10, TimeUnit.SECONDS);
    }
    executor.shutdown();
    audit.close();

    try (HikariDataSource ds = directDataSource()) {
      assertEquals(120, AuditFixtures.count(ds,
          "SELECT COUNT(*) FROM interactions WHERE session_id IN (?,?,?)",
          sessions.get(0), sessions.get(1), sessions.get(2)));
      assertEquals(3, AuditFixtures.count(ds,
          "SELECT COUNT(*) FROM sessions WHERE session_id IN (?,?,?)",
          sessions.get(0), sessions.get(1), sessions.get(2)));
    }
  }

  @Test
  void retentionSweepPurgesEverythingPastCutoff() throws Exception {
    try (HikariDataSource ds = directDataSource()) {
      try (Connection conn = ds.getConnection()) {
        SchemaProvisioner.forStore("postgresql").provision(conn);
      }
      AuditPipeline audit = JdbcAudit.builder()
          .config(new AuditConfig().setEnabled(true).setWorkers(1))
          .dataSource(ds)
          .build();
      audit.submit(AuditFixtures.record());
      audit.close();
      assertTrue(rows(ds, "interactions") >= 1);

      try (RetentionSweeper sweeper = RetentionSweeper.builder()
          .connectionProvider(new DataSourceConnectionProvider(ds))
          .purger(new JdbcInteractionPurger())
          .retentionDays(1)
          .clock(Clock.fixed(Instant.now().plus(Duration.ofDays(2)), ZoneOffset.UTC))
          .build()) {
        assertTrue(sweeper.runOnce() >= 1);
      }

      assertEquals(0, rows(ds, "interactions"));
      assertEquals(0, rows(ds, "tool_calls"));
      try (Connection conn = ds.getConnection(); Statement st = conn.createStatement()) {
        assertTrue(st.executeQuery("SELECT 1 FROM sessions LIMIT 1").next());
      }
    }
  }
}
