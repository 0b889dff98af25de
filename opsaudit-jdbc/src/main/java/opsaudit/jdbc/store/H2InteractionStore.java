package opsaudit.jdbc.store;

import java.util.List;

/**
 * H2 interaction store, used for tests and embedded deployments. Uses the default SQL and
 * the savepoint-guarded session insert.
 */
public final class H2InteractionStore extends AbstractJdbcInteractionStore {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
