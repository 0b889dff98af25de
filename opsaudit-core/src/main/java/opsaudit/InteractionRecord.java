package opsaudit;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of one question answered by the assistant: who asked, which model answered,
 * the reasoning trace, every tool call in order, and the timings collected along the way.
 *
 * <p>The collaborator generates both identifiers before submission. The session id is
 * required; the interaction id defaults to a time-ordered id from {@link InteractionIds}.
 * Tool calls keep the order in which they were added and their sequence numbers must be
 * strictly increasing. Use {@link #builder(UUID)} to create instances.
 *
 * @see ToolCallRecord
 * @see AuditPipeline#submit(InteractionRecord)
 */
public final class InteractionRecord {
    private final UUID sessionId;
    private final UUID interactionId;
    private final String userId;
    private final String clientIp;
    private final String userAgent;
    private final String question;
    private final String modelName;
    private final String provider;
    private final String baseUrl;
    private final String cluster;
    private final String thought;
    private final String finalAnswer;
    private final String status;
    private final List<ToolCallRecord> toolCalls;
    private final Map<String, Duration> metrics;
    private final Duration totalDuration;
    private final Duration assistantDuration;
    private final Duration parseDuration;

    private InteractionRecord(Builder builder) {
        this.sessionId = Objects.requireNonNull(builder.sessionId, "sessionId");
        this.interactionId = builder.interactionId == null
                ? InteractionIds.newInteractionId() : builder.interactionId;
        this.userId = builder.userId;
        this.clientIp = builder.clientIp;
        this.userAgent = builder.userAgent;
        this.question = Objects.requireNonNull(builder.question, "question");
        this.modelName = Objects.requireNonNull(builder.modelName, "modelName");
        this.provider = builder.provider;
        this.baseUrl = builder.baseUrl;
        this.cluster = builder.cluster;
        this.thought = builder.thought;
        this.finalAnswer = builder.finalAnswer;
        this.status = Objects.requireNonNull(builder.status, "status");
        this.totalDuration = nonNegative(builder.totalDuration, "totalDuration");
        this.assistantDuration = nonNegative(builder.assistantDuration, "assistantDuration");
        this.parseDuration = nonNegative(builder.parseDuration, "parseDuration");

        int previous = -1;
        for (ToolCallRecord call : builder.toolCalls) {
            if (call.sequenceNumber() == previous) {
                throw new IllegalArgumentException("Duplicate tool call sequence number " + previous);
            }
            if (call.sequenceNumber() < previous) {
                throw new IllegalArgumentException("Tool call sequence number " + call.sequenceNumber()
                        + " added after " + previous);
            }
            previous = call.sequenceNumber();
        }
        this.toolCalls = List.copyOf(builder.toolCalls);

        for (Map.Entry<String, Duration> metric : builder.metrics.entrySet()) {
            nonNegative(metric.getValue(), "metric " + metric.getKey());
        }
        this.metrics = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metrics));
    }

    private static Duration nonNegative(Duration value, String name) {
        if (value == null) {
            return Duration.ZERO;
        }
        if (value.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
        return value;
    }

    /**
     * Creates a builder for an interaction belonging to the given session.
     *
     * @param sessionId the session id, required
     * @return a new builder
     */
    public static Builder builder(UUID sessionId) {
        return new Builder(sessionId);
    }

    public UUID sessionId() {
        return sessionId;
    }

    public UUID interactionId() {
        return interactionId;
    }

    public String userId() {
        return userId;
    }

    public String clientIp() {
        return clientIp;
    }

    public String userAgent() {
        return userAgent;
    }

    public String question() {
        return question;
    }

    public String modelName() {
        return modelName;
    }

    public String provider() {
        return provider;
    }

    public String baseUrl() {
        return baseUrl;
    }

    public String cluster() {
        return cluster;
    }

    public String thought() {
        return thought;
    }

    /** Whether a non-empty reasoning trace was captured. */
    public boolean hasThought() {
        return thought != null && !thought.isEmpty();
    }

    public String finalAnswer() {
        return finalAnswer;
    }

    public String status() {
        return status;
    }

    /** Tool calls in call order. */
    public List<ToolCallRecord> toolCalls() {
        return toolCalls;
    }

    /** Performance metrics in insertion order. */
    public Map<String, Duration> metrics() {
        return metrics;
    }

    public Duration totalDuration() {
        return totalDuration;
    }

    public Duration assistantDuration() {
        return assistantDuration;
    }

    public Duration parseDuration() {
        return parseDuration;
    }

    // Question and answer text stay out of toString; they end up in logs.
    @Override
    public String toString() {
        return "InteractionRecord{interactionId=" + interactionId
                + ", sessionId=" + sessionId
                + ", modelName=" + modelName
                + ", status=" + status
                + ", toolCalls=" + toolCalls.size()
                + '}';
    }

    /**
     * Builder for {@link InteractionRecord}.
     *
     * <p>Required: session id (constructor argument), {@link #question}, {@link #modelName}
     * and {@link #status}. Everything else is optional.
     */
    public static final class Builder {
        private final UUID sessionId;
        private UUID interactionId;
        private String userId;
        private String clientIp;
        private String userAgent;
        private String question;
        private String modelName;
        private String provider;
        private String baseUrl;
        private String cluster;
        private String thought;
        private String finalAnswer;
        private String status;
        private final List<ToolCallRecord> toolCalls = new ArrayList<>();
        private final Map<String, Duration> metrics = new LinkedHashMap<>();
        private Duration totalDuration;
        private Duration assistantDuration;
        private Duration parseDuration;

        private Builder(UUID sessionId) {
            this.sessionId = sessionId;
        }

        public Builder interactionId(UUID interactionId) {
            this.interactionId = interactionId;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder clientIp(String clientIp) {
            this.clientIp = clientIp;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder question(String question) {
            this.question = question;
            return this;
        }

        public Builder modelName(String modelName) {
            this.modelName = modelName;
            return this;
        }

        public Builder provider(String provider) {
            this.provider = provider;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder cluster(String cluster) {
            this.cluster = cluster;
            return this;
        }

        public Builder thought(String thought) {
            this.thought = thought;
            return this;
        }

        public Builder finalAnswer(String finalAnswer) {
            this.finalAnswer = finalAnswer;
            return this;
        }

        /**
         * Sets the outcome label, e.g. {@code success} or {@code error}.
         *
         * @param status the status label
         * @return this builder
         */
        public Builder status(String status) {
            this.status = status;
            return this;
        }

        /**
         * Appends a tool call with the next free sequence number.
         *
         * @param toolName    the invoked tool
         * @param input       input handed to the tool
         * @param observation output of the tool, may be {@code null}
         * @param duration    time spent in the tool, may be {@code null}
         * @return this builder
         */
        public Builder addToolCall(String toolName, String input, String observation, Duration duration) {
            int next = toolCalls.isEmpty() ? 0 : toolCalls.get(toolCalls.size() - 1).sequenceNumber() + 1;
            toolCalls.add(new ToolCallRecord(toolName, input, observation, next, duration));
            return this;
        }

        /**
         * Appends a tool call carrying its own sequence number.
         *
         * @param toolCall the call
         * @return this builder
         */
        public Builder toolCall(ToolCallRecord toolCall) {
            toolCalls.add(Objects.requireNonNull(toolCall, "toolCall"));
            return this;
        }

        /**
         * Records one named timing. Re-using a name replaces the earlier value.
         *
         * @param name  metric name, e.g. {@code llm_call}
         * @param value the measured duration
         * @return this builder
         */
        public Builder metric(String name, Duration value) {
            Objects.requireNonNull(name, "metric name");
            metrics.put(name, Objects.requireNonNull(value, "metric value"));
            return this;
        }

        public Builder metrics(Map<String, Duration> values) {
            Objects.requireNonNull(values, "metrics").forEach(this::metric);
            return this;
        }

        public Builder totalDuration(Duration totalDuration) {
            this.totalDuration = totalDuration;
            return this;
        }

        public Builder assistantDuration(Duration assistantDuration) {
            this.assistantDuration = assistantDuration;
            return this;
        }

        public Builder parseDuration(Duration parseDuration) {
            this.parseDuration = parseDuration;
            return this;
        }

        /**
         * Builds the record.
         *
         * @return a new immutable record
         * @throws NullPointerException     if a required field is missing
         * @throws IllegalArgumentException if a duration is negative or tool calls are out of order
         */
        public InteractionRecord build() {
            return new InteractionRecord(this);
        }
    }
}
