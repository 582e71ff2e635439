package com.eainde.structured.backend;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.langchain4j.data.message.ChatMessage;

import java.util.List;

/**
 * The generation capability the extraction engine drives.
 *
 * <p>
 * The engine composes the prompt and validates the answer; implementations only
 * deliver the prompt to a model and return its raw text. Transport, auth and
 * model selection live entirely behind this interface.
 */
@FunctionalInterface
public interface GenerationBackend {

    /**
     * Generate raw text for the given conversation.
     *
     * @param messages       prompt turns, system instructions first
     * @param portableSchema the schema the answer must satisfy; backends with a
     *                       native structured-output mode may forward it
     * @param config         per-call backend settings
     * @return the raw generated text
     * @throws BackendInvocationException if the backend fails
     */
    String invoke(List<ChatMessage> messages, ObjectNode portableSchema, BackendConfig config)
            throws BackendInvocationException;
}
