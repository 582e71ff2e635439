package com.eainde.structured.retry;

import com.eainde.structured.validation.ValidationError;

import java.util.List;

/**
 * Serializes validation errors into the correction request sent with the next attempt.
 *
 * <pre>
 * Your previous response did not satisfy the schema "User".
 * Fix the following problems:
 * - age: missing required field
 * - tags[1]: expected string but got integer (observed: 5)
 * Respond again with a single corrected JSON object and nothing else.
 * </pre>
 */
public class FeedbackFormatter {

    private static final String DOCUMENT = "(whole response)";

    public String format(String schemaName, List<ValidationError> errors) {
        StringBuilder sb = new StringBuilder();
        sb.append("Your previous response did not satisfy the schema \"").append(schemaName).append("\".\n");
        sb.append("Fix the following problems:\n");
        for (ValidationError error : errors) {
            sb.append("- ")
                    .append(error.isDocumentLevel() ? DOCUMENT : error.dottedPath())
                    .append(": ")
                    .append(error.message());
            if (error.observedValue() != null && !error.isDocumentLevel()) {
                sb.append(" (observed: ").append(error.observedValue()).append(')');
            }
            sb.append('\n');
        }
        sb.append("Respond again with a single corrected JSON object and nothing else.");
        return sb.toString();
    }
}
