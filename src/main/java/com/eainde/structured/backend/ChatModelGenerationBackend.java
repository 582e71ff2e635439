package com.eainde.structured.backend;

import com.eainde.structured.compiler.JsonSchemaConverter;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * {@link GenerationBackend} backed by any LangChain4j {@link ChatModel}.
 *
 * <p>
 * The model is wrapped, never modified. Runtime failures raised by the model
 * are reported as transient, except {@link IllegalArgumentException}s which
 * signal a request the model will never accept.
 */
@Slf4j
public class ChatModelGenerationBackend implements GenerationBackend {

    private final ChatModel chatModel;
    private final BackendParameterMapper parameterMapper;

    public ChatModelGenerationBackend(ChatModel chatModel) {
        this(chatModel, new BackendParameterMapper());
    }

    public ChatModelGenerationBackend(ChatModel chatModel, BackendParameterMapper parameterMapper) {
        if (chatModel == null) {
            throw new IllegalArgumentException("chatModel must not be null");
        }
        this.chatModel = chatModel;
        this.parameterMapper = parameterMapper;
    }

    @Override
    public String invoke(List<ChatMessage> messages, ObjectNode portableSchema, BackendConfig config)
            throws BackendInvocationException {
        BackendConfig effective = config != null ? config : BackendConfig.defaults();
        JsonSchema jsonSchema = null;
        if (effective.nativeSchema() && portableSchema != null) {
            String name = portableSchema.has("title") ? portableSchema.get("title").asText() : null;
            jsonSchema = JsonSchemaConverter.toLangChainSchema(name, portableSchema);
        }

        ChatRequest request = ChatRequest.builder()
                .messages(messages)
                .parameters(parameterMapper.toRequestParameters(effective, jsonSchema))
                .build();

        ChatResponse response;
        try {
            response = chatModel.chat(request);
        } catch (IllegalArgumentException e) {
            throw BackendInvocationException.permanentFailure("Chat model rejected the request: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            log.warn("Chat model call failed: {}", e.getMessage());
            throw BackendInvocationException.transientFailure("Chat model call failed: " + e.getMessage(), e);
        }

        AiMessage aiMessage = response != null ? response.aiMessage() : null;
        if (aiMessage == null || aiMessage.text() == null) {
            log.debug("Chat model returned no text");
            return "";
        }
        return aiMessage.text();
    }
}
