package com.eainde.structured.retry;

import com.eainde.structured.backend.BackendInvocationException;
import com.eainde.structured.backend.GenerationBackend;
import com.eainde.structured.compiler.CompiledSchema;
import com.eainde.structured.config.ExtractionConfig;
import com.eainde.structured.validation.ValidationOutcome;
import dev.langchain4j.data.message.ChatMessage;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Drives one extraction call through the request, validate and correct loop.
 *
 * <pre>
 * PENDING -> AWAITING_BACKEND -> VALIDATING -> SUCCEEDED
 *                 ^                  |
 *                 +---- invalid -----+   (while attempts remain)
 * any non-terminal state -> FAILED
 * </pre>
 *
 * <p>
 * Transient backend failures are re-invoked with the same prompt and do not
 * consume an attempt; they draw from a budget shared by the whole call. The
 * deadline is checked before every backend invocation. A controller runs
 * once; create a new one per call.
 *
 * @param <T> type of the validated value
 */
@Slf4j
public class RetryController<T> {

    private final GenerationBackend backend;
    private final CompiledSchema compiled;
    private final ResponseCheck<T> check;
    private final ExtractionConfig config;
    private final Clock clock;
    private final AttemptListener listener;
    private final PromptComposer promptComposer;

    private RetryState state = RetryState.PENDING;

    public RetryController(GenerationBackend backend,
                           CompiledSchema compiled,
                           ResponseCheck<T> check,
                           ExtractionConfig config,
                           Clock clock,
                           AttemptListener listener) {
        this(backend, compiled, check, config, clock, listener, new PromptComposer());
    }

    public RetryController(GenerationBackend backend,
                           CompiledSchema compiled,
                           ResponseCheck<T> check,
                           ExtractionConfig config,
                           Clock clock,
                           AttemptListener listener,
                           PromptComposer promptComposer) {
        this.backend = backend;
        this.compiled = compiled;
        this.check = check;
        this.config = config != null ? config : ExtractionConfig.defaults();
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.listener = listener != null ? listener : AttemptListener.NOOP;
        this.promptComposer = promptComposer;
    }

    /**
     * Runs the loop to a terminal state.
     *
     * @param messages caller supplied prompt turns
     * @return the outcome with the full attempt history
     * @throws IllegalStateException if this controller already ran
     */
    public ExtractionResult<T> run(List<ChatMessage> messages) {
        if (state != RetryState.PENDING) {
            throw new IllegalStateException("RetryController already ran, state=" + state);
        }
        String schemaName = compiled.schemaName();
        Instant deadline = config.effectiveDeadline(clock.instant());
        int backendRetriesLeft = config.backendRetryBudget();
        List<ExtractionAttempt> attempts = new ArrayList<>();
        ExtractionAttempt lastFailure = null;

        for (int index = 1; index <= config.maxAttempts(); index++) {
            if (expired(deadline)) {
                return cancel(schemaName, attempts);
            }
            listener.onAttemptStart(schemaName, index, config.maxAttempts());
            log.debug("Extraction [{}] attempt {}/{}", schemaName, index, config.maxAttempts());

            List<ChatMessage> prompt = promptComposer.compose(messages, compiled, config.instructions(), lastFailure);
            transition(RetryState.AWAITING_BACKEND);

            String raw;
            while (true) {
                try {
                    raw = backend.invoke(prompt, compiled.portableSchema(), config.backendConfig());
                    break;
                } catch (BackendInvocationException e) {
                    if (!e.isTransient() || backendRetriesLeft == 0) {
                        log.warn("Extraction [{}] attempt {} backend failure ({}): {}",
                                schemaName, index, e.isTransient() ? "retry budget spent" : "permanent", e.getMessage());
                        return fail(schemaName, attempts, e);
                    }
                    backendRetriesLeft--;
                    log.warn("Extraction [{}] attempt {} transient backend failure, retrying ({} left): {}",
                            schemaName, index, backendRetriesLeft, e.getMessage());
                    listener.onBackendRetry(schemaName, index, backendRetriesLeft, e);
                    if (expired(deadline)) {
                        return cancel(schemaName, attempts);
                    }
                } catch (RuntimeException e) {
                    log.error("Extraction [{}] attempt {} backend threw unexpectedly", schemaName, index, e);
                    return fail(schemaName, attempts, e);
                }
            }

            transition(RetryState.VALIDATING);
            ValidationOutcome<T> outcome = check.check(raw);
            if (outcome instanceof ValidationOutcome.Valid<T> valid) {
                ExtractionAttempt success = new ExtractionAttempt(index, raw, List.of());
                attempts.add(success);
                transition(RetryState.SUCCEEDED);
                log.debug("Extraction [{}] succeeded on attempt {}", schemaName, index);
                listener.onSuccess(schemaName, success);
                return new ExtractionResult.Success<>(valid.value(), attempts);
            }

            ExtractionAttempt failed = new ExtractionAttempt(index, raw, outcome.errors());
            attempts.add(failed);
            lastFailure = failed;
            log.debug("Extraction [{}] attempt {} failed validation with {} error(s): {}",
                    schemaName, index, failed.errors().size(), failed.errors());
            listener.onAttemptFailed(schemaName, failed);
        }

        transition(RetryState.FAILED);
        log.warn("Extraction [{}] exhausted {} attempt(s)", schemaName, attempts.size());
        listener.onExhausted(schemaName, attempts);
        return new ExtractionResult.Exhausted<>(attempts);
    }

    public RetryState state() {
        return state;
    }

    private boolean expired(Instant deadline) {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    private ExtractionResult<T> cancel(String schemaName, List<ExtractionAttempt> attempts) {
        transition(RetryState.FAILED);
        log.warn("Extraction [{}] cancelled after {} attempt(s): deadline passed", schemaName, attempts.size());
        listener.onFailure(schemaName, FailureReason.CANCELLED, null);
        return new ExtractionResult.Failed<>(FailureReason.CANCELLED, attempts, null);
    }

    private ExtractionResult<T> fail(String schemaName, List<ExtractionAttempt> attempts, Exception cause) {
        transition(RetryState.FAILED);
        listener.onFailure(schemaName, FailureReason.BACKEND_FAILURE, cause);
        return new ExtractionResult.Failed<>(FailureReason.BACKEND_FAILURE, attempts, cause);
    }

    private void transition(RetryState next) {
        log.trace("{} -> {}", state, next);
        state = next;
    }
}
