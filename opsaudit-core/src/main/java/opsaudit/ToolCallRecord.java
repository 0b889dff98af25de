package opsaudit;

import java.time.Duration;
import java.util.Objects;

/**
 * One tool invocation made while answering a question.
 *
 * @param toolName       name of the invoked tool, e.g. {@code kubectl}
 * @param input          the input handed to the tool
 * @param observation    what the tool returned; may be {@code null}
 * @param sequenceNumber zero-based position of the call within its interaction
 * @param duration       time spent in the tool; {@code null} means zero
 */
public record ToolCallRecord(
    String toolName,
    String input,
    String observation,
    int sequenceNumber,
    Duration duration
) {
  public ToolCallRecord {
    Objects.requireNonNull(toolName, "toolName");
    Objects.requireNonNull(input, "input");
    if (sequenceNumber < 0) {
      throw new IllegalArgumentException("sequenceNumber must be >= 0");
    }
    duration = duration == null ? Duration.ZERO : duration;
    if (duration.isNegative()) {
      throw new IllegalArgumentException("duration must not be negative");
    }
  }
}
