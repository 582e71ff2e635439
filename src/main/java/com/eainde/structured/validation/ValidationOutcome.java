package com.eainde.structured.validation;

import java.util.List;

/**
 * Either a validated value or the errors that prevented validation.
 *
 * @param <T> type of the validated value
 */
public sealed interface ValidationOutcome<T> {

    static <T> ValidationOutcome<T> valid(T value) {
        return new Valid<>(value);
    }

    static <T> ValidationOutcome<T> invalid(List<ValidationError> errors) {
        return new Invalid<>(errors);
    }

    boolean isValid();

    /**
     * @return the collected errors; empty for a valid outcome
     */
    List<ValidationError> errors();

    record Valid<T>(T value) implements ValidationOutcome<T> {
        @Override
        public boolean isValid() {
            return true;
        }

        @Override
        public List<ValidationError> errors() {
            return List.of();
        }
    }

    record Invalid<T>(List<ValidationError> errors) implements ValidationOutcome<T> {
        public Invalid {
            if (errors == null || errors.isEmpty()) {
                throw new IllegalArgumentException("an invalid outcome needs at least one error");
            }
            errors = List.copyOf(errors);
        }

        @Override
        public boolean isValid() {
            return false;
        }
    }
}
