package opsaudit.jdbc;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Names of the five audit tables and the columns the writer depends on.
 */
public final class TableNames {
  public static final String SESSIONS = "sessions";
  public static final String INTERACTIONS = "interactions";
  public static final String THOUGHTS = "thoughts";
  public static final String TOOL_CALLS = "tool_calls";
  public static final String PERFORMANCE_METRICS = "performance_metrics";

  /** Child tables first, {@code interactions} last: the order retention deletes in. */
  public static final List<String> PURGE_ORDER =
      List.of(PERFORMANCE_METRICS, TOOL_CALLS, THOUGHTS, INTERACTIONS);

  /** Every table with the columns that must exist for the writer to work. */
  public static final Map<String, List<String>> REQUIRED_COLUMNS;

  static {
    Map<String, List<String>> columns = new LinkedHashMap<>();
    columns.put(SESSIONS, List.of("session_id", "user_id", "client_ip", "user_agent", "created_at"));
    columns.put(INTERACTIONS, List.of("interaction_id", "session_id", "question", "model_name",
        "provider", "base_url", "cluster", "final_answer", "status", "created_at",
        "total_duration_ms", "assistant_duration_ms", "parse_duration_ms"));
    columns.put(THOUGHTS, List.of("interaction_id", "thought", "created_at"));
    columns.put(TOOL_CALLS, List.of("interaction_id", "tool_name", "tool_input", "tool_observation",
        "sequence_number", "duration_ms", "created_at"));
    columns.put(PERFORMANCE_METRICS, List.of("interaction_id", "metric_name", "duration_ms", "created_at"));
    REQUIRED_COLUMNS = Collections.unmodifiableMap(columns);
  }

  private TableNames() {}
}
