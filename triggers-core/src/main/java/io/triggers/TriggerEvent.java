package io.triggers;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable record of one occurrence observed by a trigger.
 *
 * <p>Events are source-agnostic: a webhook delivery, a scheduler tick and a manual call
 * all produce the same type. {@code eventType} and {@code source} are required and
 * non-empty; every other field is optional. The payload is restricted to strings,
 * numbers, booleans and nested maps/lists, and is deep-copied at build time so all
 * handlers observe the same value.
 *
 * <p>Each event is assigned a ULID-based {@code eventId} by default.
 *
 * @see TriggerResult
 * @see Trigger#dispatch(TriggerEvent)
 */
public final class TriggerEvent {
    /** Payload key carrying the workflow name for {@code issue_workflow} events. */
    public static final String WORKFLOW_KEY = "workflow";

    private final String eventId;
    private final String eventType;
    private final Map<String, Object> payload;
    private final String source;
    private final Instant timestamp;
    private final String adwId;
    private final Integer issueNumber;
    private final String repoPath;

    private TriggerEvent(Builder builder) {
        this.eventType = requireNonEmpty(builder.eventType, "eventType");
        this.source = requireNonEmpty(builder.source, "source");
        this.eventId = builder.eventId == null ? newEventId() : builder.eventId;
        this.payload = Payloads.copyOf(builder.payload);
        this.timestamp = builder.timestamp == null ? Instant.now() : builder.timestamp;
        this.adwId = builder.adwId;
        this.issueNumber = builder.issueNumber;
        this.repoPath = builder.repoPath;
    }

    /**
     * Creates a builder for an event of the given type.
     *
     * @param eventType the kind of occurrence, e.g. {@code "issue_workflow"}
     * @return a new builder
     */
    public static Builder builder(String eventType) {
        return new Builder(eventType);
    }

    public String eventId() {
        return eventId;
    }

    public String eventType() {
        return eventType;
    }

    /**
     * Returns the unmodifiable payload. Never {@code null}; empty when none was supplied.
     *
     * @return the payload
     */
    public Map<String, Object> payload() {
        return payload;
    }

    public String source() {
        return source;
    }

    public Instant timestamp() {
        return timestamp;
    }

    public String adwId() {
        return adwId;
    }

    public Integer issueNumber() {
        return issueNumber;
    }

    public String repoPath() {
        return repoPath;
    }

    /**
     * Returns {@code payload["workflow"]} when it is a string, otherwise {@code null}.
     *
     * @return the requested workflow name, or {@code null}
     */
    public String workflow() {
        Object value = payload.get(WORKFLOW_KEY);
        return value instanceof String s ? s : null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("TriggerEvent{eventId=").append(eventId)
                .append(", eventType=").append(eventType)
                .append(", source=").append(source)
                .append(", timestamp=").append(timestamp);
        if (adwId != null) {
            sb.append(", adwId=").append(adwId);
        }
        if (issueNumber != null) {
            sb.append(", issueNumber=").append(issueNumber);
        }
        if (repoPath != null) {
            sb.append(", repoPath=").append(repoPath);
        }
        return sb.append('}').toString();
    }

    private static String requireNonEmpty(String value, String field) {
        Objects.requireNonNull(value, field);
        if (value.isEmpty()) {
            throw new IllegalArgumentException(field + " cannot be empty");
        }
        return value;
    }

    private static String newEventId() {
        return UlidCreator.getMonotonicUlid().toString();
    }

    /**
     * Builder for {@link TriggerEvent}.
     */
    public static final class Builder {
        private final String eventType;
        private String eventId;
        private Map<String, ?> payload;
        private String source;
        private Instant timestamp;
        private String adwId;
        private Integer issueNumber;
        private String repoPath;

        private Builder(String eventType) {
            this.eventType = eventType;
        }

        /**
         * Sets a custom event identifier.
         *
         * <p>Optional. Defaults to a monotonic ULID.
         *
         * @param eventId the event identifier
         * @return this builder
         */
        public Builder eventId(String eventId) {
            this.eventId = eventId;
            return this;
        }

        /**
         * Sets the payload. Copied at build time.
         *
         * <p>Optional. Defaults to an empty map. Values must be strings, booleans, immutable
         * numbers ({@code Integer}, {@code Long}, {@code Double}, {@code BigDecimal}, ...),
         * or maps/lists of those; nulls and mutable numbers are rejected.
         *
         * @param payload handler-defined data
         * @return this builder
         */
        public Builder payload(Map<String, ?> payload) {
            this.payload = payload;
            return this;
        }

        /**
         * Sets the name of the originating trigger or channel, e.g. {@code "manual"}.
         *
         * <p><b>Required.</b>
         *
         * @param source the event source
         * @return this builder
         */
        public Builder source(String source) {
            this.source = source;
            return this;
        }

        /**
         * Sets when the event occurred.
         *
         * <p>Optional. Defaults to {@link Instant#now()} at build time.
         *
         * @param timestamp the occurrence time
         * @return this builder
         */
        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        /**
         * Correlates the event with an existing unit of work.
         *
         * @param adwId the workflow run identifier
         * @return this builder
         */
        public Builder adwId(String adwId) {
            this.adwId = adwId;
            return this;
        }

        public Builder issueNumber(Integer issueNumber) {
            this.issueNumber = issueNumber;
            return this;
        }

        /**
         * Sets the repository path ({@code owner/repo}) the event refers to.
         *
         * @param repoPath the repository path
         * @return this builder
         */
        public Builder repoPath(String repoPath) {
            this.repoPath = repoPath;
            return this;
        }

        /**
         * Builds an immutable {@link TriggerEvent}.
         *
         * @return a new event
         * @throws NullPointerException     if {@code eventType} or {@code source} is null
         * @throws IllegalArgumentException if {@code eventType} or {@code source} is empty,
         *                                  or the payload contains an unsupported value
         */
        public TriggerEvent build() {
            return new TriggerEvent(this);
        }
    }
}
