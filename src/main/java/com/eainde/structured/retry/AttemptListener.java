package com.eainde.structured.retry;

import java.util.List;

/**
 * Callbacks fired by the {@link RetryController} as an extraction call
 * progresses. Lets callers plug in metrics or audit logging without coupling
 * the engine to a monitoring system. All methods default to no-ops.
 */
public interface AttemptListener {

    AttemptListener NOOP = new AttemptListener() {
    };

    /**
     * @param schemaName  schema being extracted
     * @param attempt     1-based attempt number
     * @param maxAttempts configured attempt limit
     */
    default void onAttemptStart(String schemaName, int attempt, int maxAttempts) {
    }

    /**
     * A transient backend failure is about to be retried.
     *
     * @param retriesLeft backend retries remaining after this one
     */
    default void onBackendRetry(String schemaName, int attempt, int retriesLeft, Exception cause) {
    }

    /**
     * An attempt produced output that failed validation.
     */
    default void onAttemptFailed(String schemaName, ExtractionAttempt attempt) {
    }

    default void onSuccess(String schemaName, ExtractionAttempt attempt) {
    }

    default void onExhausted(String schemaName, List<ExtractionAttempt> attempts) {
    }

    default void onFailure(String schemaName, FailureReason reason, Throwable cause) {
    }
}
