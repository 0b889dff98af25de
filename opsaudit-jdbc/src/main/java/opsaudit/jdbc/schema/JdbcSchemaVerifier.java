package opsaudit.jdbc.schema;

import opsaudit.StoreUnavailableException;
import opsaudit.jdbc.TableNames;
import opsaudit.spi.SchemaVerifier;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Verifies through {@link DatabaseMetaData} that every audit table exists in the connection's
 * current schema with all columns the writer uses. Creates nothing.
 */
public final class JdbcSchemaVerifier implements SchemaVerifier {
  private final Map<String, List<String>> requiredColumns;

  public JdbcSchemaVerifier() {
    this(TableNames.REQUIRED_COLUMNS);
  }

  JdbcSchemaVerifier(Map<String, List<String>> requiredColumns) {
    this.requiredColumns = requiredColumns;
  }

  @Override
  public void verify(Connection conn) throws SQLException {
    DatabaseMetaData meta = conn.getMetaData();
    List<String> problems = new ArrayList<>();
    for (Map.Entry<String, List<String>> table : requiredColumns.entrySet()) {
      Set<String> present = columns(conn, meta, table.getKey());
      if (present.isEmpty()) {
        problems.add("missing table " + table.getKey());
        continue;
      }
      List<String> missing = new ArrayList<>();
      for (String column : table.getValue()) {
        if (!present.contains(column)) {
          missing.add(column);
        }
      }
      if (!missing.isEmpty()) {
        problems.add("table " + table.getKey() + " lacks columns " + missing);
      }
    }
    if (!problems.isEmpty()) {
      throw new StoreUnavailableException("Audit schema incomplete: " + String.join("; ", problems));
    }
  }

  private static Set<String> columns(Connection conn, DatabaseMetaData meta, String table)
      throws SQLException {
    Set<String> names = new HashSet<>();
    try (ResultSet rs = meta.getColumns(conn.getCatalog(), conn.getSchema(), identifier(meta, table), null)) {
      while (rs.next()) {
        names.add(rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT));
      }
    }
    return names;
  }

  private static String identifier(DatabaseMetaData meta, String name) throws SQLException {
    if (meta.storesUpperCaseIdentifiers()) {
      return name.toUpperCase(Locale.ROOT);
    }
    if (meta.storesLowerCaseIdentifiers()) {
      return name.toLowerCase(Locale.ROOT);
    }
    return name;
  }
}
