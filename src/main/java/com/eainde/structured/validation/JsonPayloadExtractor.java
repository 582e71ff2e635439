package com.eainde.structured.validation;

/**
 * Unwraps a JSON payload that a backend wrapped in a markdown code fence.
 * Anything else is returned trimmed and untouched.
 */
final class JsonPayloadExtractor {

    private static final String FENCE = "```";

    private JsonPayloadExtractor() {
    }

    static String unwrap(String raw) {
        String text = raw.trim();
        if (!text.startsWith(FENCE) || !text.endsWith(FENCE) || text.length() < 2 * FENCE.length()) {
            return text;
        }
        // skip the language tag on the opening line, e.g. ```json
        int newline = text.indexOf('\n');
        int end = text.length() - FENCE.length();
        if (newline < 0 || newline >= end) {
            return text.substring(FENCE.length(), end).trim();
        }
        return text.substring(newline + 1, end).trim();
    }
}
