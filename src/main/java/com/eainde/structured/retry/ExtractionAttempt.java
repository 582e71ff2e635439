package com.eainde.structured.retry;

import com.eainde.structured.validation.ValidationError;

import java.util.List;

/**
 * One request/response/validate cycle of an extraction call.
 *
 * @param index     1-based attempt number
 * @param rawOutput text returned by the backend
 * @param errors    validation errors; empty for the successful attempt
 */
public record ExtractionAttempt(int index, String rawOutput, List<ValidationError> errors) {

    public ExtractionAttempt {
        if (index < 1) {
            throw new IllegalArgumentException("index must be >= 1");
        }
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public boolean isSuccessful() {
        return errors.isEmpty();
    }
}
