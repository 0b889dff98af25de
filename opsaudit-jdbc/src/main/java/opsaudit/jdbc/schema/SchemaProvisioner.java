package opsaudit.jdbc.schema;

import opsaudit.jdbc.AuditStoreException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Creates the audit tables and indexes from the {@code opsaudit/schema/<store>.sql} resource.
 *
 * <p>Every statement is {@code IF NOT EXISTS}, so provisioning an existing schema is a no-op.
 * Provisioning is never part of normal start-up; it runs only when explicitly requested.
 */
public final class SchemaProvisioner {
  private static final String RESOURCE_DIR = "opsaudit/schema/";

  private final List<String> statements;

  private SchemaProvisioner(List<String> statements) {
    this.statements = statements;
  }

  /**
   * Loads the DDL shipped for a store.
   *
   * @param storeName store name, e.g. {@code postgresql} or {@code h2}
   * @return a provisioner for that store
   * @throws IllegalArgumentException if no DDL is shipped for the store
   */
  public static SchemaProvisioner forStore(String storeName) {
    Objects.requireNonNull(storeName, "storeName");
    String resource = RESOURCE_DIR + storeName.toLowerCase() + ".sql";
    try (InputStream in = SchemaProvisioner.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalArgumentException("No schema resource for store " + storeName + ": " + resource);
      }
      return new SchemaProvisioner(split(new String(in.readAllBytes(), StandardCharsets.UTF_8)));
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read " + resource, e);
    }
  }

  static List<String> split(String script) {
    StringBuilder cleaned = new StringBuilder();
    for (String line : script.split("\\R")) {
      String trimmed = line.trim();
      if (!trimmed.startsWith("--")) {
        cleaned.append(line).append('\n');
      }
    }
    List<String> result = new ArrayList<>();
    for (String statement : cleaned.toString().split(";")) {
      if (!statement.isBlank()) {
        result.add(statement.trim());
      }
    }
    return result;
  }

  /** The DDL statements in execution order. */
  public List<String> statements() {
    return statements;
  }

  /**
   * Executes every statement on {@code conn}, committing once at the end when the connection
   * is not in auto-commit mode.
   *
   * @param conn the connection
   * @throws AuditStoreException if a statement fails
   */
  public void provision(Connection conn) {
    try (Statement st = conn.createStatement()) {
      for (String sql : statements) {
        st.execute(sql);
      }
      if (!conn.getAutoCommit()) {
        conn.commit();
      }
    } catch (SQLException e) {
      throw new AuditStoreException("Failed to provision audit schema", e);
    }
  }
}
