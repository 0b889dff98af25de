package opsaudit.jdbc.store;

import opsaudit.InteractionRecord;
import opsaudit.jdbc.TableNames;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * PostgreSQL interaction store.
 *
 * <p>Session rows use {@code ON CONFLICT (session_id) DO NOTHING}, so two workers that see a
 * new session at the same time never produce a second row or a failed batch.
 */
public final class PostgresInteractionStore extends AbstractJdbcInteractionStore {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected String insertSessionSql() {
    return "INSERT INTO " + TableNames.SESSIONS
        + " (session_id, user_id, client_ip, user_agent, created_at) VALUES (?,?,?,?,?)"
        + " ON CONFLICT (session_id) DO NOTHING";
  }

  @Override
  public void insertSession(Connection conn, InteractionRecord record, Instant createdAt) {
    writeSession(conn, record, createdAt);
  }
}
