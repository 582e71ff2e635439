package com.eainde.structured.retry;

/**
 * Thrown by {@link ExtractionResult#orElseThrow()} for results without a value.
 */
public class ExtractionFailedException extends RuntimeException {

    private final transient ExtractionResult<?> result;

    public ExtractionFailedException(ExtractionResult<?> result) {
        super(describe(result), result instanceof ExtractionResult.Failed<?> failed ? failed.cause() : null);
        this.result = result;
    }

    public ExtractionResult<?> getResult() {
        return result;
    }

    private static String describe(ExtractionResult<?> result) {
        if (result instanceof ExtractionResult.Exhausted<?> exhausted) {
            return "Extraction exhausted after " + exhausted.attempts().size()
                    + " attempt(s); last errors: " + exhausted.lastErrors();
        }
        if (result instanceof ExtractionResult.Failed<?> failed) {
            String detail = failed.cause() != null ? ": " + failed.cause().getMessage() : "";
            return "Extraction failed (" + failed.reason() + ") after "
                    + failed.attempts().size() + " attempt(s)" + detail;
        }
        return "Extraction did not produce a value";
    }
}
