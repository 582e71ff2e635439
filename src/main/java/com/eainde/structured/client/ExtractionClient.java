package com.eainde.structured.client;

import com.eainde.structured.backend.GenerationBackend;
import com.eainde.structured.compiler.CompilationCache;
import com.eainde.structured.compiler.CompiledSchema;
import com.eainde.structured.compiler.SchemaCompiler;
import com.eainde.structured.config.ExtractionConfig;
import com.eainde.structured.instance.Instance;
import com.eainde.structured.parallel.NamedInstance;
import com.eainde.structured.parallel.ParallelSchemaSet;
import com.eainde.structured.retry.AttemptListener;
import com.eainde.structured.retry.ExtractionResult;
import com.eainde.structured.retry.RetryController;
import com.eainde.structured.schema.SchemaDefinition;
import com.eainde.structured.validation.ResponseValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.ChatMessage;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;

/**
 * Entry point for schema-driven extraction.
 *
 * <p>
 * Wraps a {@link GenerationBackend} and runs each call through a fresh
 * {@link RetryController}. Compiled schemas are shared through a
 * {@link CompilationCache}; nothing else is shared between calls, so a single
 * client can serve concurrent callers.
 *
 * <pre>
 * ExtractionClient client = ExtractionClient.builder()
 *         .backend(new ChatModelGenerationBackend(chatModel))
 *         .build();
 * Instance user = client.extract(userSchema, List.of(UserMessage.from(text))).orElseThrow();
 * </pre>
 */
@Slf4j
@Getter
public class ExtractionClient {

    private final GenerationBackend backend;
    private final CompilationCache compilationCache;
    private final ObjectMapper objectMapper;
    private final ExtractionConfig defaultConfig;
    private final AttemptListener listener;
    private final Clock clock;

    @Builder
    private ExtractionClient(GenerationBackend backend,
                             CompilationCache compilationCache,
                             ObjectMapper objectMapper,
                             ExtractionConfig defaultConfig,
                             AttemptListener listener,
                             Clock clock) {
        if (backend == null) {
            throw new IllegalArgumentException("backend must not be null");
        }
        this.backend = backend;
        this.compilationCache = compilationCache != null ? compilationCache : new CompilationCache(new SchemaCompiler());
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
        this.defaultConfig = defaultConfig != null ? defaultConfig : ExtractionConfig.defaults();
        this.listener = listener != null ? listener : AttemptListener.NOOP;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    public static ExtractionClient of(GenerationBackend backend) {
        return builder().backend(backend).build();
    }

    /**
     * Extracts an instance of {@code schema} using the client's default config.
     */
    public ExtractionResult<Instance> extract(SchemaDefinition schema, List<ChatMessage> messages) {
        return extract(schema, messages, defaultConfig);
    }

    /**
     * Extracts an instance of {@code schema} from the conversation in {@code messages}.
     *
     * @return a success with the validated instance, or the reason it could not
     *         be produced along with every attempt made
     */
    public ExtractionResult<Instance> extract(SchemaDefinition schema, List<ChatMessage> messages,
                                              ExtractionConfig config) {
        ExtractionConfig effective = config != null ? config : defaultConfig;
        CompiledSchema compiled = compilationCache.get(schema);
        ResponseValidator validator = new ResponseValidator(objectMapper, effective.strictUnknownFields());

        log.info("Extracting '{}' (maxAttempts={}, backendRetryBudget={})",
                schema.getName(), effective.maxAttempts(), effective.backendRetryBudget());
        RetryController<Instance> controller = new RetryController<>(backend, compiled,
                raw -> validator.validate(raw, schema), effective, clock, listener);
        ExtractionResult<Instance> result = controller.run(messages);
        logOutcome(schema.getName(), result);
        return result;
    }

    /**
     * Extracts any number of instances, each conforming to one schema of {@code set}.
     */
    public ExtractionResult<List<NamedInstance>> extractParallel(ParallelSchemaSet set, List<ChatMessage> messages,
                                                                 ExtractionConfig config) {
        ExtractionConfig effective = config != null ? config : defaultConfig;
        CompiledSchema compiled = set.compile(compilationCache.getCompiler());
        ResponseValidator validator = new ResponseValidator(objectMapper, effective.strictUnknownFields());

        log.info("Extracting parallel set {} (maxAttempts={})", set, effective.maxAttempts());
        RetryController<List<NamedInstance>> controller = new RetryController<>(backend, compiled,
                raw -> set.validate(raw, validator), effective, clock, listener);
        ExtractionResult<List<NamedInstance>> result = controller.run(messages);
        logOutcome(set.getName(), result);
        return result;
    }

    public ExtractionResult<List<NamedInstance>> extractParallel(ParallelSchemaSet set, List<ChatMessage> messages) {
        return extractParallel(set, messages, defaultConfig);
    }

    private static void logOutcome(String name, ExtractionResult<?> result) {
        if (result instanceof ExtractionResult.Success<?> success) {
            log.info("Extraction '{}' succeeded after {} attempt(s)", name, success.attemptCount());
        } else if (result instanceof ExtractionResult.Failed<?> failed) {
            log.info("Extraction '{}' failed ({}) after {} attempt(s)", name, failed.reason(), failed.attempts().size());
        } else {
            log.info("Extraction '{}' exhausted after {} attempt(s)", name, result.attempts().size());
        }
    }
}
