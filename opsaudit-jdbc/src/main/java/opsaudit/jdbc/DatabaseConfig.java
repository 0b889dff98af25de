package opsaudit.jdbc;

import java.time.Duration;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Connection settings for the audit database.
 *
 * <p>{@link #validate()} is called by {@link JdbcUrls#of(DatabaseConfig)} and
 * {@link HikariDataSources#create(DatabaseConfig)}. The password is never part of
 * {@link #toString()}.
 */
public final class DatabaseConfig {
  public static final Set<String> SUPPORTED_DRIVERS = Set.of("postgresql");
  public static final Set<String> SSL_MODES =
      Set.of("disable", "allow", "prefer", "require", "verify-ca", "verify-full");
  private static final Pattern DB_NAME = Pattern.compile("[A-Za-z0-9_\\-]+");

  private String driver = "postgresql";
  private String host;
  private int port = 5432;
  private String user;
  private String password;
  private String dbName;
  private String sslMode = "disable";
  private int maxOpenConns = 10;
  private int maxIdleConns = 2;
  private Duration connMaxLifetime = Duration.ofHours(1);
  private Duration connectTimeout = Duration.ofSeconds(10);

  public String getDriver() {
    return driver;
  }

  public DatabaseConfig setDriver(String driver) {
    this.driver = driver;
    return this;
  }

  public String getHost() {
    return host;
  }

  public DatabaseConfig setHost(String host) {
    this.host = host;
    return this;
  }

  public int getPort() {
    return port;
  }

  public DatabaseConfig setPort(int port) {
    this.port = port;
    return this;
  }

  public String getUser() {
    return user;
  }

  public DatabaseConfig setUser(String user) {
    this.user = user;
    return this;
  }

  public String getPassword() {
    return password;
  }

  public DatabaseConfig setPassword(String password) {
    this.password = password;
    return this;
  }

  public String getDbName() {
    return dbName;
  }

  public DatabaseConfig setDbName(String dbName) {
    this.dbName = dbName;
    return this;
  }

  public String getSslMode() {
    return sslMode;
  }

  public DatabaseConfig setSslMode(String sslMode) {
    this.sslMode = sslMode;
    return this;
  }

  public int getMaxOpenConns() {
    return maxOpenConns;
  }

  public DatabaseConfig setMaxOpenConns(int maxOpenConns) {
    this.maxOpenConns = maxOpenConns;
    return this;
  }

  public int getMaxIdleConns() {
    return maxIdleConns;
  }

  public DatabaseConfig setMaxIdleConns(int maxIdleConns) {
    this.maxIdleConns = maxIdleConns;
    return this;
  }

  public Duration getConnMaxLifetime() {
    return connMaxLifetime;
  }

  public DatabaseConfig setConnMaxLifetime(Duration connMaxLifetime) {
    this.connMaxLifetime = connMaxLifetime;
    return this;
  }

  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  public DatabaseConfig setConnectTimeout(Duration connectTimeout) {
    this.connectTimeout = connectTimeout;
    return this;
  }

  /**
   * Checks every value against its allowed range.
   *
   * @throws IllegalArgumentException naming the first invalid option
   */
  public void validate() {
    if (driver == null || !SUPPORTED_DRIVERS.contains(driver.toLowerCase())) {
      throw new IllegalArgumentException("Unsupported database driver: " + driver
          + ". Supported: " + SUPPORTED_DRIVERS);
    }
    if (host == null || host.isBlank()) {
      throw new IllegalArgumentException("database host must be set");
    }
    if (port < 1 || port > 65535) {
      throw new IllegalArgumentException("database port must be in 1..65535: " + port);
    }
    if (dbName == null || !DB_NAME.matcher(dbName).matches()) {
      throw new IllegalArgumentException("Invalid database name: " + dbName);
    }
    if (sslMode == null || !SSL_MODES.contains(sslMode)) {
      throw new IllegalArgumentException("Invalid sslmode: " + sslMode + ". Allowed: " + SSL_MODES);
    }
    validatePool();
  }

  /**
   * Checks the pool sizing and timeouts only.
   *
   * @throws IllegalArgumentException naming the first invalid option
   */
  public void validatePool() {
    if (maxOpenConns < 1) {
      throw new IllegalArgumentException("maxOpenConns must be >= 1");
    }
    if (maxIdleConns < 0 || maxIdleConns > maxOpenConns) {
      throw new IllegalArgumentException("maxIdleConns must be in 0..maxOpenConns");
    }
    if (connMaxLifetime == null || connMaxLifetime.isZero() || connMaxLifetime.isNegative()) {
      throw new IllegalArgumentException("connMaxLifetime must be > 0");
    }
    if (connectTimeout == null || connectTimeout.isZero() || connectTimeout.isNegative()) {
      throw new IllegalArgumentException("connectTimeout must be > 0");
    }
  }

  @Override
  public String toString() {
    return "DatabaseConfig{driver=" + driver
        + ", host=" + host
        + ", port=" + port
        + ", user=" + user
        + ", dbName=" + dbName
        + ", sslMode=" + sslMode
        + ", maxOpenConns=" + maxOpenConns
        + ", maxIdleConns=" + maxIdleConns
        + '}';
  }
}
