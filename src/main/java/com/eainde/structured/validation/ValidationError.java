package com.eainde.structured.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * A single problem found while validating backend output.
 *
 * @param fieldPath     path segments from the document root; empty for
 *                      whole-document errors. Array elements appear as
 *                      {@code name[index]}
 * @param kind          error classification
 * @param message       human readable description, also used as feedback
 * @param observedValue the offending raw value as JSON text, or null
 */
public record ValidationError(List<String> fieldPath, ErrorKind kind, String message, String observedValue) {

    private static final int MAX_OBSERVED_LENGTH = 200;

    public ValidationError {
        fieldPath = fieldPath == null ? List.of() : List.copyOf(fieldPath);
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (observedValue != null && observedValue.length() > MAX_OBSERVED_LENGTH) {
            observedValue = observedValue.substring(0, MAX_OBSERVED_LENGTH) + "...";
        }
    }

    public static ValidationError missingField(List<String> path) {
        return new ValidationError(path, ErrorKind.MISSING_FIELD, "missing required field", null);
    }

    public static ValidationError typeMismatch(List<String> path, String expected, String observed, String actualType) {
        return new ValidationError(path, ErrorKind.TYPE_MISMATCH,
                "expected " + expected + " but got " + actualType, observed);
    }

    public static ValidationError unknownField(List<String> path, String observed) {
        return new ValidationError(path, ErrorKind.UNKNOWN_FIELD, "field is not declared by the schema", observed);
    }

    public static ValidationError parseFailure(String message, String observed) {
        return new ValidationError(List.of(), ErrorKind.PARSE_FAILURE, message, observed);
    }

    /**
     * @return the path joined with dots, or an empty string for the document root
     */
    public String dottedPath() {
        return String.join(".", fieldPath);
    }

    public boolean isDocumentLevel() {
        return fieldPath.isEmpty();
    }

    /**
     * @return a copy of this error with {@code prefix} prepended to the path
     */
    public ValidationError prefixed(List<String> prefix) {
        if (prefix.isEmpty()) {
            return this;
        }
        List<String> path = new ArrayList<>(prefix);
        path.addAll(fieldPath);
        return new ValidationError(path, kind, message, observedValue);
    }

    @Override
    public String toString() {
        String where = fieldPath.isEmpty() ? "<document>" : dottedPath();
        return kind + " at " + where + ": " + message + (observedValue != null ? " (observed: " + observedValue + ")" : "");
    }
}
