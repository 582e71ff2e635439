package com.eainde.structured.config;

import com.eainde.structured.backend.BackendConfig;

import java.time.Duration;
import java.time.Instant;

/**
 * Settings for one extraction call.
 *
 * <pre>
 * ExtractionConfig config = ExtractionConfig.builder()
 *         .maxAttempts(4)
 *         .backendRetryBudget(1)
 *         .strictUnknownFields(true)
 *         .timeout(Duration.ofSeconds(30))
 *         .build();
 * </pre>
 *
 * @param maxAttempts         upper bound on validation attempts, at least 1
 * @param backendRetryBudget  re-invocations allowed for transient backend
 *                            failures across the whole call, at least 0
 * @param strictUnknownFields whether undeclared keys are validation errors
 * @param timeout             time allowed for the whole call, measured from its
 *                            start; null for none
 * @param deadline            absolute deadline; null for none
 * @param instructions        system instructions placed before the schema
 *                            description; null for the built-in text
 * @param backendConfig       settings forwarded to the backend
 */
public record ExtractionConfig(
        int maxAttempts,
        int backendRetryBudget,
        boolean strictUnknownFields,
        Duration timeout,
        Instant deadline,
        String instructions,
        BackendConfig backendConfig
) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final int DEFAULT_BACKEND_RETRY_BUDGET = 2;

    public ExtractionConfig {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
        }
        if (backendRetryBudget < 0) {
            throw new IllegalArgumentException("backendRetryBudget must be >= 0, was " + backendRetryBudget);
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive, was " + timeout);
        }
        backendConfig = backendConfig != null ? backendConfig : BackendConfig.defaults();
    }

    public static ExtractionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxAttempts(maxAttempts)
                .backendRetryBudget(backendRetryBudget)
                .strictUnknownFields(strictUnknownFields)
                .timeout(timeout)
                .deadline(deadline)
                .instructions(instructions)
                .backendConfig(backendConfig);
    }

    /**
     * @param start when the call started
     * @return the earlier of {@link #deadline()} and {@code start + timeout}, or
     *         null when neither is set
     */
    public Instant effectiveDeadline(Instant start) {
        Instant fromTimeout = timeout != null ? start.plus(timeout) : null;
        if (deadline == null) return fromTimeout;
        if (fromTimeout == null) return deadline;
        return deadline.isBefore(fromTimeout) ? deadline : fromTimeout;
    }

    public static class Builder {
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private int backendRetryBudget = DEFAULT_BACKEND_RETRY_BUDGET;
        private boolean strictUnknownFields;
        private Duration timeout;
        private Instant deadline;
        private String instructions;
        private BackendConfig backendConfig;

        private Builder() {
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder backendRetryBudget(int backendRetryBudget) {
            this.backendRetryBudget = backendRetryBudget;
            return this;
        }

        public Builder strictUnknownFields(boolean strictUnknownFields) {
            this.strictUnknownFields = strictUnknownFields;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder deadline(Instant deadline) {
            this.deadline = deadline;
            return this;
        }

        public Builder instructions(String instructions) {
            this.instructions = instructions;
            return this;
        }

        public Builder backendConfig(BackendConfig backendConfig) {
            this.backendConfig = backendConfig;
            return this;
        }

        public ExtractionConfig build() {
            return new ExtractionConfig(maxAttempts, backendRetryBudget, strictUnknownFields,
                    timeout, deadline, instructions, backendConfig);
        }
    }
}
