package com.eainde.structured.retry;

import com.eainde.structured.validation.ValidationError;

import java.util.List;

/**
 * Outcome of an extraction call.
 *
 * <p>Exactly one of:</p>
 * <ul>
 *   <li>{@link Success}: a validated value and the attempts it took</li>
 *   <li>{@link Exhausted}: every attempt failed validation</li>
 *   <li>{@link Failed}: the backend gave up or the deadline passed</li>
 * </ul>
 *
 * <p>
 * Every variant carries the attempt history, so failures always come with
 * their diagnostic context.
 *
 * @param <T> type of the extracted value
 */
public sealed interface ExtractionResult<T> {

    /**
     * @return attempts in order, indices strictly increasing from 1
     */
    List<ExtractionAttempt> attempts();

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * @return the extracted value
     * @throws ExtractionFailedException if this is not a {@link Success}
     */
    default T orElseThrow() {
        if (this instanceof Success<T> success) {
            return success.value();
        }
        throw new ExtractionFailedException(this);
    }

    record Success<T>(T value, List<ExtractionAttempt> attempts) implements ExtractionResult<T> {
        public Success {
            attempts = List.copyOf(attempts);
        }

        public int attemptCount() {
            return attempts.size();
        }
    }

    record Exhausted<T>(List<ExtractionAttempt> attempts) implements ExtractionResult<T> {
        public Exhausted {
            if (attempts == null || attempts.isEmpty()) {
                throw new IllegalArgumentException("an exhausted result needs at least one attempt");
            }
            attempts = List.copyOf(attempts);
        }

        /**
         * @return the errors of the final attempt
         */
        public List<ValidationError> lastErrors() {
            return attempts.get(attempts.size() - 1).errors();
        }
    }

    /**
     * @param reason   why the call ended
     * @param attempts attempts completed before the failure, possibly none
     * @param cause    backend exception, or null when cancelled
     */
    record Failed<T>(FailureReason reason, List<ExtractionAttempt> attempts, Throwable cause)
            implements ExtractionResult<T> {
        public Failed {
            if (reason == null) {
                throw new IllegalArgumentException("reason must not be null");
            }
            attempts = List.copyOf(attempts);
        }
    }
}
