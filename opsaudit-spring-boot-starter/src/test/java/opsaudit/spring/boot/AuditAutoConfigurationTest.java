package opsaudit.spring.boot;

import opsaudit.AuditPipeline;
import opsaudit.InteractionIds;
import opsaudit.InteractionRecord;
import opsaudit.pipeline.AsyncAuditPipeline;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Duration;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class AuditAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          AuditAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:audit_" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver");

  @Test
  void disabledByDefault() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("auditPipeline"));
      assertSame(AuditPipeline.NOOP, ctx.getBean(AuditPipeline.class));
      assertNotNull(ctx.getBean(AuditProperties.class));
    });
  }

  @Test
  void writesThroughApplicationDataSource() {
    runner
        .withPropertyValues(
            "opsaudit.enabled=true",
            "opsaudit.schema.provision=true",
            "opsaudit.async.workers=1",
            "opsaudit.async.batch-interval=100ms")
        .run(ctx -> {
          AuditPipeline pipeline = ctx.getBean(AuditPipeline.class);
          assertInstanceOf(AsyncAuditPipeline.class, pipeline);

          pipeline.submit(InteractionRecord.builder(InteractionIds.newSessionId())
              .question("which pods restarted in the last hour?")
              .modelName("gpt-4o")
              .status("success")
              .addToolCall("kubectl", "get pods -A", "web-1 restarts=3", Duration.ofMillis(140))
              .build());
          pipeline.close();

          DataSource ds = ctx.getBean(DataSource.class);
          assertEquals(1, count(ds, "interactions"));
          assertEquals(1, count(ds, "tool_calls"));
          assertEquals(1, count(ds, "sessions"));
        });
  }

  @Test
  void missingSchemaFallsBackToNoop() {
    runner
        .withPropertyValues("opsaudit.enabled=true")
        .run(ctx -> {
          assertNull(ctx.getStartupFailure());
          assertSame(AuditPipeline.NOOP, ctx.getBean(AuditPipeline.class));
        });
  }

  @Test
  void noDataSourceFallsBackToNoop() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(AuditAutoConfiguration.class))
        .withPropertyValues("opsaudit.enabled=true")
        .run(ctx -> assertSame(AuditPipeline.NOOP, ctx.getBean(AuditPipeline.class)));
  }

  @Test
  void dedicatedDatabaseTakesPrecedence() {
    runner
        .withPropertyValues(
            "opsaudit.enabled=true",
            "opsaudit.schema.provision=true",
            "opsaudit.database.host=127.0.0.1",
            "opsaudit.database.port=1",
            "opsaudit.database.db-name=ops_audit",
            "opsaudit.database.user=ops",
            "opsaudit.database.connect-timeout=500ms")
        .run(ctx -> {
          assertNull(ctx.getStartupFailure());
          assertSame(AuditPipeline.NOOP, ctx.getBean(AuditPipeline.class));
        });
  }

  @Test
  void invalidSettingsFailStartup() {
    runner
        .withPropertyValues("opsaudit.enabled=true", "opsaudit.async.batch-size=0")
        .run(ctx -> {
          assertNotNull(ctx.getStartupFailure());
          assertInstanceOf(IllegalArgumentException.class, findRootCause(ctx.getStartupFailure()));
        });
  }

  @Test
  void backsOffWhenPipelineDefined() {
    runner
        .withPropertyValues("opsaudit.enabled=true")
        .withUserConfiguration(CustomPipelineConfig.class)
        .run(ctx -> assertSame(CustomPipelineConfig.PIPELINE, ctx.getBean(AuditPipeline.class)));
  }

  private static int count(DataSource ds, String table) throws Exception {
    try (Connection conn = ds.getConnection();
         Statement st = conn.createStatement();
         ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + table)) {
      rs.next();
      return rs.getInt(1);
    }
  }

  private static Throwable findRootCause(Throwable t) {
    while (t.getCause() != null) {
      t = t.getCause();
    }
    return t;
  }

  @Configuration
  static class CustomPipelineConfig {
    static final AuditPipeline PIPELINE = new AuditPipeline() {
      @Override
      public void submit(InteractionRecord record) {
      }

      @Override
      public boolean isEnabled() {
        return true;
      }

      @Override
      public void close() {
      }
    };

    @Bean
    AuditPipeline customAuditPipeline() {
      return PIPELINE;
    }
  }
}
