package opsaudit.jdbc;

import opsaudit.AuditConfig;
import opsaudit.AuditPipeline;
import opsaudit.InteractionIds;
import opsaudit.InteractionRecord;
import opsaudit.pipeline.AsyncAuditPipeline;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.UUID;

import static opsaudit.jdbc.AuditFixtures.count;
import static opsaudit.jdbc.AuditFixtures.rows;
import static org.junit.jupiter.api.Assertions.*;

class JdbcAuditTest {

  private static AuditConfig enabled() {
    return new AuditConfig().setEnabled(true).setWorkers(1).setBatchInterval(Duration.ofMillis(200));
  }

  @Test
  void dataSourceWithProvisionedSchemaPersistsOnClose() throws Exception {
    JdbcDataSource ds = AuditFixtures.newH2();
    AuditPipeline audit = JdbcAudit.builder()
        .config(enabled())
        .dataSource(ds)
        .provisionSchema(true)
        .build();
    assertInstanceOf(AsyncAuditPipeline.class, audit);

    UUID sessionId = InteractionIds.newSessionId();
    InteractionRecord rec = InteractionRecord.builder(sessionId)
        .question("what is using the most memory in namespace payments?")
        .modelName("deepseek-chat")
        .provider("deepseek")
        .status("success")
        .thought("top pods by memory")
        .addToolCall("kubectl", "top pods -n payments", "ledger-0 1.2Gi", Duration.ofMillis(300))
        .metric("llm_call", Duration.ofMillis(1500))
        .build();
    audit.submit(rec);
    audit.close();

    assertEquals(1, count(ds, "SELECT COUNT(*) FROM interactions WHERE session_id=?", sessionId));
    assertEquals(1, rows(ds, "thoughts"));
    assertEquals(1, rows(ds, "tool_calls"));
    assertEquals(1, rows(ds, "performance_metrics"));
  }

  @Test
  void existingSchemaNeedsNoProvisioning() throws Exception {
    JdbcDataSource ds = AuditFixtures.newH2WithSchema();
    AuditPipeline audit = JdbcAudit.builder().config(enabled()).dataSource(ds).build();

    assertTrue(audit.isEnabled());
    audit.submit(AuditFixtures.record());
    audit.close();
    assertEquals(1, rows(ds, "interactions"));
  }

  @Test
  void missingSchemaDisablesAuditing() {
    AuditPipeline audit = JdbcAudit.builder()
        .config(enabled())
        .dataSource(AuditFixtures.newH2())
        .build();

    assertSame(AuditPipeline.NOOP, audit);
    assertDoesNotThrow(() -> audit.submit(AuditFixtures.record()));
  }

  @Test
  void disabledConfigNeverTouchesDatabase() {
    AuditPipeline audit = JdbcAudit.builder()
        .config(new AuditConfig())
        .database(new DatabaseConfig().setDriver("mysql"))
        .build();

    assertSame(AuditPipeline.NOOP, audit);
    assertFalse(audit.isEnabled());
  }

  @Test
  void unreachableDatabaseDisablesAuditing() {
    AuditPipeline audit = JdbcAudit.builder()
        .config(enabled())
        .database(new DatabaseConfig()
            .setHost("127.0.0.1")
            .setPort(1)
            .setDbName("ops_audit")
            .setUser("ops")
            .setConnectTimeout(Duration.ofMillis(500)))
        .build();

    assertSame(AuditPipeline.NOOP, audit);
  }

  @Test
  void rejectsInvalidConfiguration() {
    assertThrows(IllegalArgumentException.class, () -> JdbcAudit.builder()
        .config(enabled())
        .database(new DatabaseConfig().setDriver("mysql").setHost("db").setDbName("audit"))
        .build());
    assertThrows(IllegalArgumentException.class, () -> JdbcAudit.builder()
        .config(enabled().setBatchSize(0))
        .dataSource(AuditFixtures.newH2())
        .build());
    assertThrows(IllegalArgumentException.class, () -> JdbcAudit.builder()
        .config(enabled())
        .database(new DatabaseConfig().setHost("db").setDbName("audit"))
        .dataSource(AuditFixtures.newH2())
        .build());
    assertThrows(NullPointerException.class, () -> JdbcAudit.builder().config(enabled()).build());
  }
}
