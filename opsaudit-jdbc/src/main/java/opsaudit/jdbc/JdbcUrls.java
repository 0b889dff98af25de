package opsaudit.jdbc;

/**
 * Builds the one JDBC URL used for a {@link DatabaseConfig}.
 *
 * <p>Credentials are not part of the URL; they are handed to the pool separately.
 */
public final class JdbcUrls {

  private JdbcUrls() {}

  /**
   * Returns {@code jdbc:postgresql://host:port/dbname?sslmode=mode}.
   *
   * @param config the database settings
   * @return the JDBC URL
   * @throws IllegalArgumentException if the settings are invalid
   */
  public static String of(DatabaseConfig config) {
    config.validate();
    String host = config.getHost().trim();
    if (host.indexOf(':') >= 0 && !host.startsWith("[")) {
      host = "[" + host + "]";
    }
    return "jdbc:" + config.getDriver().toLowerCase() + "://" + host + ":" + config.getPort()
        + "/" + config.getDbName() + "?sslmode=" + config.getSslMode();
  }
}
