package com.eainde.structured.retry;

/**
 * Why an extraction call ended without a value, other than running out of attempts.
 */
public enum FailureReason {
    /** The backend failed beyond its retry budget, or failed permanently. */
    BACKEND_FAILURE,

    /** The caller's deadline passed between attempts. */
    CANCELLED
}
