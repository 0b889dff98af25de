package opsaudit.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JdbcUrlsTest {

  private static DatabaseConfig valid() {
    return new DatabaseConfig()
        .setHost("audit-db.internal")
        .setDbName("ops_audit")
        .setUser("ops")
        .setPassword("s3cret");
  }

  @Test
  void buildsCanonicalPostgresUrl() {
    assertEquals("jdbc:postgresql://audit-db.internal:5432/ops_audit?sslmode=disable",
        JdbcUrls.of(valid()));
    assertEquals("jdbc:postgresql://10.0.0.7:6543/ops-audit?sslmode=verify-full",
        JdbcUrls.of(valid().setHost("10.0.0.7").setPort(6543).setDbName("ops-audit")
            .setSslMode("verify-full")));
  }

  @Test
  void bracketsIpv6Hosts() {
    assertEquals("jdbc:postgresql://[::1]:5432/ops_audit?sslmode=disable",
        JdbcUrls.of(valid().setHost("::1")));
  }

  @Test
  void neverContainsCredentials() {
    String url = JdbcUrls.of(valid());
    assertFalse(url.contains("s3cret"));
    assertFalse(url.contains("ops@"));
  }

  @Test
  void rejectsInvalidSettings() {
    assertThrows(IllegalArgumentException.class, () -> JdbcUrls.of(valid().setDriver("mysql")));
    assertThrows(IllegalArgumentException.class, () -> JdbcUrls.of(valid().setHost(" ")));
    assertThrows(IllegalArgumentException.class, () -> JdbcUrls.of(valid().setPort(0)));
    assertThrows(IllegalArgumentException.class, () -> JdbcUrls.of(valid().setPort(70000)));
    assertThrows(IllegalArgumentException.class, () -> JdbcUrls.of(valid().setDbName("audit;drop")));
    assertThrows(IllegalArgumentException.class, () -> JdbcUrls.of(valid().setSslMode("maybe")));
  }
}
