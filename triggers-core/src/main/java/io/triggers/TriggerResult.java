package io.triggers;

import java.util.Objects;

/**
 * Outcome of one handler processing one {@link TriggerEvent}.
 *
 * <p>All fields except {@code success} are optional and handler-defined. A failed
 * result is expected to carry an {@code error} for diagnostics; results synthesized by
 * {@link Trigger#dispatch(TriggerEvent)} for a failing handler always do.
 *
 * <pre>{@code
 * trigger.addHandler(event -> TriggerResult.builder(true)
 *     .workflow(event.workflow())
 *     .adwId(runId)
 *     .message("started")
 *     .build());
 * }</pre>
 */
public final class TriggerResult {

    private final boolean success;
    private final String adwId;
    private final String workflow;
    private final String message;
    private final String error;

    private TriggerResult(Builder builder) {
        this.success = builder.success;
        this.adwId = builder.adwId;
        this.workflow = builder.workflow;
        this.message = builder.message;
        this.error = builder.error;
    }

    public static Builder builder(boolean success) {
        return new Builder(success);
    }

    /**
     * Creates a bare successful result.
     *
     * @return a result with {@code success = true} and no other fields
     */
    public static TriggerResult ok() {
        return builder(true).build();
    }

    /**
     * Creates a successful result with a message.
     *
     * @param message human-readable outcome
     * @return a successful result
     */
    public static TriggerResult ok(String message) {
        return builder(true).message(message).build();
    }

    /**
     * Creates a failed result.
     *
     * @param error failure detail
     * @return a result with {@code success = false}
     * @throws NullPointerException if {@code error} is null
     */
    public static TriggerResult failure(String error) {
        return builder(false).error(Objects.requireNonNull(error, "error")).build();
    }

    public boolean success() {
        return success;
    }

    public String adwId() {
        return adwId;
    }

    public String workflow() {
        return workflow;
    }

    public String message() {
        return message;
    }

    public String error() {
        return error;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TriggerResult that)) return false;
        return success == that.success
                && Objects.equals(adwId, that.adwId)
                && Objects.equals(workflow, that.workflow)
                && Objects.equals(message, that.message)
                && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(success, adwId, workflow, message, error);
    }

    @Override
    public String toString() {
        return "TriggerResult{success=" + success
                + ", adwId=" + adwId
                + ", workflow=" + workflow
                + ", message=" + message
                + ", error=" + error + '}';
    }

    /**
     * Builder for {@link TriggerResult}.
     */
    public static final class Builder {
        private final boolean success;
        private String adwId;
        private String workflow;
        private String message;
        private String error;

        private Builder(boolean success) {
            this.success = success;
        }

        public Builder adwId(String adwId) {
            this.adwId = adwId;
            return this;
        }

        public Builder workflow(String workflow) {
            this.workflow = workflow;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public TriggerResult build() {
            return new TriggerResult(this);
        }
    }
}
