package com.eainde.structured.config;

import com.eainde.structured.backend.GenerationBackend;
import com.eainde.structured.client.ExtractionClient;
import com.eainde.structured.compiler.CompilationCache;
import com.eainde.structured.compiler.SchemaCompiler;
import com.eainde.structured.retry.AttemptListener;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

import java.time.Duration;

/**
 * Spring wiring for the extraction engine.
 *
 * <p>
 * Defaults come from {@code structured-extraction.properties} and can be
 * overridden by any property source of the application. The importing
 * application supplies the {@link GenerationBackend} bean; an
 * {@link AttemptListener} bean is picked up when present.
 */
@Slf4j
@Configuration
@PropertySource(value = "classpath:structured-extraction.properties", ignoreResourceNotFound = true)
public class ExtractionConfiguration {

    @Value("${extraction.max-attempts:3}")
    private int maxAttempts;

    @Value("${extraction.backend-retry-budget:2}")
    private int backendRetryBudget;

    @Value("${extraction.strict-unknown-fields:false}")
    private boolean strictUnknownFields;

    // ISO-8601, e.g. PT30S; blank disables the timeout
    @Value("${extraction.timeout:}")
    private String timeout;

    @Bean
    public ExtractionConfig extractionConfig() {
        ExtractionConfig config = ExtractionConfig.builder()
                .maxAttempts(maxAttempts)
                .backendRetryBudget(backendRetryBudget)
                .strictUnknownFields(strictUnknownFields)
                .timeout(timeout == null || timeout.isBlank() ? null : Duration.parse(timeout.trim()))
                .build();
        log.info("Extraction defaults: maxAttempts={}, backendRetryBudget={}, strictUnknownFields={}, timeout={}",
                config.maxAttempts(), config.backendRetryBudget(), config.strictUnknownFields(), config.timeout());
        return config;
    }

    @Bean
    public SchemaCompiler schemaCompiler() {
        return new SchemaCompiler();
    }

    @Bean
    public CompilationCache compilationCache(SchemaCompiler schemaCompiler) {
        return new CompilationCache(schemaCompiler);
    }

    @Bean
    public ExtractionClient extractionClient(GenerationBackend generationBackend,
                                             CompilationCache compilationCache,
                                             ExtractionConfig extractionConfig,
                                             ObjectProvider<ObjectMapper> objectMapper,
                                             ObjectProvider<AttemptListener> attemptListener) {
        return ExtractionClient.builder()
                .backend(generationBackend)
                .compilationCache(compilationCache)
                .defaultConfig(extractionConfig)
                .objectMapper(objectMapper.getIfAvailable(ObjectMapper::new))
                .listener(attemptListener.getIfAvailable(() -> AttemptListener.NOOP))
                .build();
    }
}
