package opsaudit.spring.boot;

import opsaudit.AuditPipeline;
import opsaudit.jdbc.JdbcAudit;
import opsaudit.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Auto-configuration for the audit pipeline.
 *
 * <p>With {@code opsaudit.database.host} set, the pipeline owns a dedicated HikariCP pool.
 * Otherwise it writes through the application's {@link DataSource}. Without either, or when
 * the store fails start-up verification, the bean is {@link AuditPipeline#NOOP} and the
 * application starts normally.
 *
 * @see AuditProperties
 * @see AuditMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(JdbcAudit.class)
@EnableConfigurationProperties(AuditProperties.class)
public class AuditAutoConfiguration {
  private static final Logger logger = Logger.getLogger(AuditAutoConfiguration.class.getName());

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public AuditPipeline auditPipeline(AuditProperties props,
      ObjectProvider<DataSource> dataSourceProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {

    JdbcAudit.Builder builder = JdbcAudit.builder()
        .config(props.toAuditConfig())
        .provisionSchema(props.getSchema().isProvision());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    if (!props.isEnabled()) {
      return builder.build();
    }

    String host = props.getDatabase().getHost();
    if (host != null && !host.isBlank()) {
      return builder.database(props.toDatabaseConfig()).build();
    }
    DataSource dataSource = dataSourceProvider.getIfUnique();
    if (dataSource == null) {
      logger.log(Level.WARNING,
          "opsaudit.enabled is true but neither opsaudit.database.host nor a unique DataSource "
              + "is available; audit logging disabled");
      return AuditPipeline.NOOP;
    }
    return builder.dataSource(dataSource).build();
  }
}
