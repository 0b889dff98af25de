package opsaudit.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.util.Objects;

/**
 * Creates the HikariCP pool for the audit database.
 *
 * <p>The pool is created without opening a connection, so an unreachable database does not
 * fail here; start-up verification reports it instead.
 */
public final class HikariDataSources {
  static final String POOL_NAME = "opsaudit";

  private HikariDataSources() {}

  public static HikariDataSource create(DatabaseConfig config) {
    return create(JdbcUrls.of(config), config);
  }

  /**
   * Creates a pool for {@code jdbcUrl} sized and timed by {@code config}.
   *
   * @param jdbcUrl the JDBC URL
   * @param config  credentials and pool settings; host and database name are not used
   * @return a new pool; the caller owns it
   */
  public static HikariDataSource create(String jdbcUrl, DatabaseConfig config) {
    Objects.requireNonNull(jdbcUrl, "jdbcUrl");
    config.validatePool();
    HikariConfig hikari = new HikariConfig();
    hikari.setPoolName(POOL_NAME);
    hikari.setJdbcUrl(jdbcUrl);
    hikari.setUsername(config.getUser());
    hikari.setPassword(config.getPassword());
    hikari.setMaximumPoolSize(config.getMaxOpenConns());
    hikari.setMinimumIdle(config.getMaxIdleConns());
    hikari.setMaxLifetime(config.getConnMaxLifetime().toMillis());
    hikari.setConnectionTimeout(config.getConnectTimeout().toMillis());
    hikari.setInitializationFailTimeout(-1);
    return new HikariDataSource(hikari);
  }
}
