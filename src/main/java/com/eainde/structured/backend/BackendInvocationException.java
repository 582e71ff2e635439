package com.eainde.structured.backend;

/**
 * Checked exception thrown by a {@link GenerationBackend} when it cannot
 * produce output.
 *
 * <p>
 * Checked because backend failures are expected: the retry controller
 * re-invokes the backend for transient failures within its retry budget and
 * reports everything else to the caller.
 */
public class BackendInvocationException extends Exception {

    private final boolean transientFailure;

    /**
     * @param message          human-readable error description
     * @param transientFailure true when retrying the same request may succeed
     *                         (timeouts, throttling, 5xx)
     */
    public BackendInvocationException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    /**
     * @param message          human-readable error description
     * @param transientFailure true when retrying the same request may succeed
     * @param cause            underlying cause
     */
    public BackendInvocationException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public static BackendInvocationException transientFailure(String message, Throwable cause) {
        return new BackendInvocationException(message, true, cause);
    }

    public static BackendInvocationException permanentFailure(String message, Throwable cause) {
        return new BackendInvocationException(message, false, cause);
    }

    /**
     * @return true if the same request may succeed when re-invoked
     */
    public boolean isTransient() {
        return transientFailure;
    }
}
