package com.eainde.structured.retry;

/**
 * States of one extraction call. {@link #SUCCEEDED} and {@link #FAILED} are terminal.
 */
public enum RetryState {
    PENDING,
    AWAITING_BACKEND,
    VALIDATING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
