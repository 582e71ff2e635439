package com.eainde.structured.retry;

import com.eainde.structured.compiler.CompiledSchema;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the message list for one attempt.
 *
 * <p>
 * Layout: a system message with the instructions, the prompt text and the
 * portable schema; then the caller's messages; then, after a failed attempt,
 * that attempt's raw output as an assistant turn followed by the feedback.
 * Only the most recent failure is replayed, keeping prompts bounded.
 */
public class PromptComposer {

    static final String DEFAULT_INSTRUCTIONS =
            "Extract the requested information and answer with a single JSON object "
                    + "that conforms to the schema below. Do not add any commentary.";

    private final FeedbackFormatter feedbackFormatter;

    public PromptComposer() {
        this(new FeedbackFormatter());
    }

    public PromptComposer(FeedbackFormatter feedbackFormatter) {
        this.feedbackFormatter = feedbackFormatter;
    }

    /**
     * @param messages        caller supplied prompt turns
     * @param compiled        compiled schema of the extraction
     * @param instructions    system instructions, null for the default text
     * @param previousFailure most recent failed attempt, null on the first attempt
     */
    public List<ChatMessage> compose(List<ChatMessage> messages,
                                     CompiledSchema compiled,
                                     String instructions,
                                     ExtractionAttempt previousFailure) {
        List<ChatMessage> prompt = new ArrayList<>(messages.size() + 3);
        prompt.add(SystemMessage.from(systemText(compiled, instructions)));
        prompt.addAll(messages);

        if (previousFailure != null) {
            String raw = previousFailure.rawOutput();
            if (raw != null && !raw.isBlank()) {
                prompt.add(AiMessage.from(raw));
            }
            prompt.add(UserMessage.from(feedbackFormatter.format(compiled.schemaName(), previousFailure.errors())));
        }
        return prompt;
    }

    private static String systemText(CompiledSchema compiled, String instructions) {
        String intro = instructions == null || instructions.isBlank() ? DEFAULT_INSTRUCTIONS : instructions;
        return intro + "\n\n" + compiled.promptText() + "\nJSON schema:\n" + compiled.portableSchemaJson();
    }
}
