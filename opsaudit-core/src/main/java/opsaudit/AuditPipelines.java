package opsaudit;

import opsaudit.pipeline.AsyncAuditPipeline;
import opsaudit.retention.RetentionSweeper;
import opsaudit.spi.ConnectionProvider;
import opsaudit.spi.InteractionPurger;
import opsaudit.spi.InteractionStore;
import opsaudit.spi.MetricsExporter;
import opsaudit.spi.SchemaVerifier;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Start-up entry point that turns an {@link AuditConfig} and a store into a running
 * {@link AuditPipeline}.
 *
 * <p>{@link Builder#build()} returns {@link AuditPipeline#NOOP} when auditing is disabled or
 * when the store cannot be verified; store problems are logged, never thrown. Otherwise it
 * starts an {@link AsyncAuditPipeline} with its workers and, when retention cleanup is
 * enabled, a {@link RetentionSweeper}.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * AuditPipeline audit = AuditPipelines.builder()
 *     .config(config)
 *     .connectionProvider(connectionProvider)
 *     .store(store)
 *     .purger(purger)
 *     .schemaVerifier(verifier)
 *     .resource(dataSource)
 *     .build();
 * // request handlers: audit.submit(record);
 * // at shutdown:      audit.close();
 * }</pre>
 */
public final class AuditPipelines {

  private AuditPipelines() {
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for a started {@link AuditPipeline}. */
  public static final class Builder {
    private AuditConfig config;
    private ConnectionProvider connectionProvider;
    private InteractionStore store;
    private InteractionPurger purger;
    private SchemaVerifier schemaVerifier;
    private AutoCloseable resource;
    private MetricsExporter metrics;
    private Logger logger;
    private Clock clock;

    private Builder() {}

    /**
     * Sets the pipeline configuration.
     *
     * <p><b>Required.</b>
     *
     * @param config the configuration
     * @return this builder
     */
    public Builder config(AuditConfig config) {
      this.config = config;
      return this;
    }

    /**
     * Sets the connection provider used by workers, the sweeper and verification.
     *
     * <p><b>Required</b> when auditing is enabled.
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the store that writes audit rows.
     *
     * <p><b>Required</b> when auditing is enabled.
     *
     * @param store the store
     * @return this builder
     */
    public Builder store(InteractionStore store) {
      this.store = store;
      return this;
    }

    /**
     * Sets the purger for retention sweeps.
     *
     * <p><b>Required</b> when retention cleanup is enabled.
     *
     * @param purger the purger
     * @return this builder
     */
    public Builder purger(InteractionPurger purger) {
      this.purger = purger;
      return this;
    }

    /**
     * Sets the start-up check.
     *
     * <p>Optional. Defaults to {@link SchemaVerifier#CONNECTIVITY}.
     *
     * @param schemaVerifier the verifier
     * @return this builder
     */
    public Builder schemaVerifier(SchemaVerifier schemaVerifier) {
      this.schemaVerifier = schemaVerifier;
      return this;
    }

    /**
     * Hands over a resource, typically the connection pool, that the pipeline closes after its
     * final flush. It is also closed right away if the pipeline ends up disabled.
     *
     * <p>Optional.
     *
     * @param resource the owned resource
     * @return this builder
     */
    public Builder resource(AutoCloseable resource) {
      this.resource = resource;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the logger for the pipeline and everything it starts.
     *
     * <p>Optional. Defaults to the class loggers.
     *
     * @param logger the logger
     * @return this builder
     */
    public Builder logger(Logger logger) {
      this.logger = logger;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Verifies the store and starts the pipeline.
     *
     * @return a running pipeline, or {@link AuditPipeline#NOOP}
     * @throws NullPointerException     if a required collaborator is missing
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public AuditPipeline build() {
      Objects.requireNonNull(config, "config");
      Logger log = logger != null ? logger : Logger.getLogger(AuditPipelines.class.getName());
      if (!config.isEnabled()) {
        log.info("Audit logging disabled");
        close(resource, log);
        return AuditPipeline.NOOP;
      }
      config.validate();
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      Objects.requireNonNull(store, "store");
      AuditConfig.Retention retention = config.getRetention();
      if (retention.isActive()) {
        Objects.requireNonNull(purger, "purger");
      }

      try {
        verify();
      } catch (StoreUnavailableException e) {
        log.log(Level.SEVERE, "Audit store unavailable; audit logging disabled: " + e.getMessage(), e);
        close(resource, log);
        return AuditPipeline.NOOP;
      }

      RetentionSweeper sweeper = null;
      if (retention.isActive()) {
        sweeper = RetentionSweeper.builder()
            .connectionProvider(connectionProvider)
            .purger(purger)
            .retentionDays(retention.getDays())
            .cleanupTime(retention.getCleanupTime())
            .zone(retention.getZone())
            .clock(clock)
            .metrics(metrics)
            .logger(logger)
            .build();
      }

      AsyncAuditPipeline pipeline = AsyncAuditPipeline.builder()
          .connectionProvider(connectionProvider)
          .store(store)
          .workerCount(config.getWorkers())
          .queueCapacity(config.getQueueSize())
          .batchSize(config.getBatchSize())
          .batchInterval(config.getBatchInterval())
          .drainTimeout(config.getDrainTimeout())
          .sweeper(sweeper)
          .resource(resource)
          .metrics(metrics)
          .logger(logger)
          .clock(clock)
          .build();
      pipeline.start();
      log.log(Level.INFO, "Audit logging enabled: {0}", config);
      return pipeline;
    }

    private void verify() {
      SchemaVerifier verifier = schemaVerifier != null ? schemaVerifier : SchemaVerifier.CONNECTIVITY;
      try (Connection conn = connectionProvider.getConnection()) {
        verifier.verify(conn);
      } catch (SQLException e) {
        throw new StoreUnavailableException("Cannot reach audit store", e);
      } catch (StoreUnavailableException e) {
        throw e;
      } catch (RuntimeException e) {
        throw new StoreUnavailableException("Audit store verification failed", e);
      }
    }

    private static void close(AutoCloseable resource, Logger log) {
      if (resource == null) {
        return;
      }
      try {
        resource.close();
      } catch (Exception e) {
        log.log(Level.WARNING, "Failed to close audit store resource", e);
      }
    }
  }
}
