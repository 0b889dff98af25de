package opsaudit.jdbc;

import com.zaxxer.hikari.HikariDataSource;
import opsaudit.AuditConfig;
import opsaudit.AuditPipeline;
import opsaudit.AuditPipelines;
import opsaudit.jdbc.purge.JdbcInteractionPurger;
import opsaudit.jdbc.schema.JdbcSchemaVerifier;
import opsaudit.jdbc.schema.SchemaProvisioner;
import opsaudit.jdbc.store.AbstractJdbcInteractionStore;
import opsaudit.jdbc.store.JdbcInteractionStores;
import opsaudit.spi.MetricsExporter;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One-call JDBC bootstrap: picks the store, builds the HikariCP pool when given connection
 * settings, optionally provisions the schema, and starts the pipeline through
 * {@link AuditPipelines}.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * AuditPipeline audit = JdbcAudit.builder()
 *     .config(new AuditConfig().setEnabled(true))
 *     .database(new DatabaseConfig().setHost("db").setDbName("audit").setUser("ops"))
 *     .build();
 * }</pre>
 *
 * <p>A pool created here is owned by the pipeline and closed after its final flush. A
 * {@link DataSource} passed in is left open.
 */
public final class JdbcAudit {

  private JdbcAudit() {
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for a JDBC-backed {@link AuditPipeline}. */
  public static final class Builder {
    private AuditConfig config;
    private DatabaseConfig database;
    private DataSource dataSource;
    private boolean provisionSchema;
    private MetricsExporter metrics;
    private Logger logger;
    private Clock clock;

    private Builder() {}

    /**
     * <p><b>Required.</b>
     *
     * @param config the pipeline configuration
     * @return this builder
     */
    public Builder config(AuditConfig config) {
      this.config = config;
      return this;
    }

    /**
     * Connection settings for a pool created and owned by the pipeline. Mutually exclusive
     * with {@link #dataSource}.
     *
     * @param database the database settings
     * @return this builder
     */
    public Builder database(DatabaseConfig database) {
      this.database = database;
      return this;
    }

    /**
     * An existing data source, not closed by the pipeline. Mutually exclusive with
     * {@link #database}.
     *
     * @param dataSource the data source
     * @return this builder
     */
    public Builder dataSource(DataSource dataSource) {
      this.dataSource = dataSource;
      return this;
    }

    /**
     * Creates missing tables and indexes before verification.
     *
     * <p>Optional. Defaults to {@code false}.
     *
     * @param provisionSchema whether to run the shipped DDL
     * @return this builder
     */
    public Builder provisionSchema(boolean provisionSchema) {
      this.provisionSchema = provisionSchema;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder logger(Logger logger) {
      this.logger = logger;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Builds and starts the pipeline.
     *
     * @return a running pipeline, or {@link AuditPipeline#NOOP} if disabled or the store is
     *     unavailable
     * @throws IllegalArgumentException if the configuration is invalid or both
     *     {@code database} and {@code dataSource} are set
     */
    public AuditPipeline build() {
      Objects.requireNonNull(config, "config");
      Logger log = logger != null ? logger : Logger.getLogger(JdbcAudit.class.getName());
      if (!config.isEnabled()) {
        return AuditPipelines.builder().config(config).logger(logger).build();
      }
      if (database != null && dataSource != null) {
        throw new IllegalArgumentException("Set either database or dataSource, not both");
      }
      config.validate();

      DataSource ds;
      HikariDataSource ownedPool = null;
      AbstractJdbcInteractionStore store;
      if (database != null) {
        database.validate();
        store = JdbcInteractionStores.get(database.getDriver());
        ownedPool = HikariDataSources.create(database);
        ds = ownedPool;
        log.log(Level.INFO, "Audit database: {0}", database);
      } else {
        ds = Objects.requireNonNull(dataSource, "database or dataSource");
        try {
          store = JdbcInteractionStores.detect(ds);
        } catch (IllegalStateException e) {
          log.log(Level.SEVERE, "Audit store unavailable; audit logging disabled: " + e.getMessage(), e);
          return AuditPipeline.NOOP;
        }
      }

      DataSourceConnectionProvider connectionProvider = new DataSourceConnectionProvider(ds);
      if (provisionSchema) {
        provision(connectionProvider, store, log);
      }

      return AuditPipelines.builder()
          .config(config)
          .connectionProvider(connectionProvider)
          .store(store)
          .purger(new JdbcInteractionPurger())
          .schemaVerifier(new JdbcSchemaVerifier())
          .resource(ownedPool)
          .metrics(metrics)
          .logger(logger)
          .clock(clock)
          .build();
    }

    // Failures here surface again, with the reason, in schema verification.
    private static void provision(DataSourceConnectionProvider connectionProvider,
        AbstractJdbcInteractionStore store, Logger log) {
      try (Connection conn = connectionProvider.getConnection()) {
        SchemaProvisioner.forStore(store.name()).provision(conn);
        log.log(Level.INFO, "Provisioned audit schema for {0}", store.name());
      } catch (SQLException | RuntimeException e) {
        log.log(Level.SEVERE, "Audit schema provisioning failed", e);
      }
    }
  }
}
