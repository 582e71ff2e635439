package com.eainde.structured.retry;

import com.eainde.structured.validation.ValidationOutcome;

/**
 * Turns raw backend output into a validated value or validation errors.
 *
 * @param <T> type of the validated value
 */
@FunctionalInterface
public interface ResponseCheck<T> {

    ValidationOutcome<T> check(String rawOutput);
}
