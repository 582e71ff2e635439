package com.eainde.structured.backend;

/**
 * Per-call settings forwarded to the generation backend. Null means "use the
 * backend's own default".
 *
 * @param modelName        model identifier override
 * @param temperature      sampling temperature
 * @param topP             nucleus sampling
 * @param topK             top-k sampling
 * @param maxOutputTokens  output token cap
 * @param nativeSchema     whether to send the schema as a native response format
 *                         (otherwise plain JSON mode is requested)
 */
public record BackendConfig(
        String modelName,
        Double temperature,
        Double topP,
        Integer topK,
        Integer maxOutputTokens,
        boolean nativeSchema
) {

    private static final BackendConfig DEFAULTS = new BackendConfig(null, null, null, null, null, true);

    public static BackendConfig defaults() {
        return DEFAULTS;
    }

    public BackendConfig withModelName(String modelName) {
        return new BackendConfig(modelName, temperature, topP, topK, maxOutputTokens, nativeSchema);
    }

    public BackendConfig withTemperature(Double temperature) {
        return new BackendConfig(modelName, temperature, topP, topK, maxOutputTokens, nativeSchema);
    }

    public BackendConfig withMaxOutputTokens(Integer maxOutputTokens) {
        return new BackendConfig(modelName, temperature, topP, topK, maxOutputTokens, nativeSchema);
    }

    public BackendConfig withNativeSchema(boolean nativeSchema) {
        return new BackendConfig(modelName, temperature, topP, topK, maxOutputTokens, nativeSchema);
    }
}
