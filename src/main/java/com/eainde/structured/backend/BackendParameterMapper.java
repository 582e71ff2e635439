package com.eainde.structured.backend;

import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.request.DefaultChatRequestParameters;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.request.json.JsonSchema;

/**
 * Maps a {@link BackendConfig} onto LangChain4j request parameters.
 */
public class BackendParameterMapper {

    /**
     * @param config     backend settings, may be null
     * @param jsonSchema schema to request natively; null requests plain JSON mode
     */
    public ChatRequestParameters toRequestParameters(BackendConfig config, JsonSchema jsonSchema) {
        DefaultChatRequestParameters.Builder<?> builder = ChatRequestParameters.builder();

        if (config != null) {
            if (config.modelName() != null) {
                builder.modelName(config.modelName());
            }
            if (config.maxOutputTokens() != null) {
                builder.maxOutputTokens(config.maxOutputTokens());
            }
            if (config.temperature() != null) {
                builder.temperature(config.temperature());
            }
            if (config.topP() != null) {
                builder.topP(config.topP());
            }
            if (config.topK() != null) {
                builder.topK(config.topK());
            }
        }

        // The response is always JSON; the schema rides along only in native mode.
        ResponseFormat.Builder format = ResponseFormat.builder().type(ResponseFormatType.JSON);
        if (jsonSchema != null) {
            format.jsonSchema(jsonSchema);
        }
        builder.responseFormat(format.build());

        return builder.build();
    }
}
