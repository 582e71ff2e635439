package com.eainde.structured.retry;

import com.eainde.structured.TestSchemas;
import com.eainde.structured.backend.BackendInvocationException;
import com.eainde.structured.backend.GenerationBackend;
import com.eainde.structured.compiler.CompiledSchema;
import com.eainde.structured.compiler.SchemaCompiler;
import com.eainde.structured.config.ExtractionConfig;
import com.eainde.structured.instance.Instance;
import com.eainde.structured.schema.SchemaDefinition;
import com.eainde.structured.validation.ErrorKind;
import com.eainde.structured.validation.ResponseValidator;
import com.eainde.structured.validation.ValidationError;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.UserMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RetryControllerTest {

    private static final String MISSING_AGE = "{\"name\":\"Jason\"}";
    private static final String AGE_AS_TEXT = "{\"name\":\"Jason\",\"age\":\"25\"}";
    private static final String VALID = "{\"name\":\"Jason\",\"age\":25}";
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private GenerationBackend backend;

    @Mock
    private AttemptListener listener;

    @Captor
    private ArgumentCaptor<List<ChatMessage>> promptCaptor;

    private final SchemaDefinition user = TestSchemas.user();
    private final CompiledSchema compiled = new SchemaCompiler().compile(user);
    private final ResponseValidator validator = new ResponseValidator(false);
    private final List<ChatMessage> messages = List.of(UserMessage.from("Extract: Jason is 25 years old"));

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
    }

    private RetryController<Instance> controller(ExtractionConfig config) {
        return new RetryController<>(backend, compiled, raw -> validator.validate(raw, user), config, clock, listener);
    }

    @Nested
    @DisplayName("Validation retries")
    class ValidationRetries {

        @Test
        @DisplayName("should converge on the third attempt and feed back only the latest failure")
        void convergesOnThirdAttempt() throws Exception {
            when(backend.invoke(anyList(), any(), any())).thenReturn(MISSING_AGE, AGE_AS_TEXT, VALID);
            RetryController<Instance> controller = controller(ExtractionConfig.builder().maxAttempts(3).build());

            ExtractionResult<Instance> result = controller.run(messages);

            assertThat(result).isInstanceOf(ExtractionResult.Success.class);
            assertThat(result.orElseThrow().getLong("age")).isEqualTo(25L);
            assertThat(result.attempts()).extracting(ExtractionAttempt::index).containsExactly(1, 2, 3);
            assertThat(result.attempts().get(0).errors()).extracting(ValidationError::kind).containsExactly(ErrorKind.MISSING_FIELD);
            assertThat(result.attempts().get(1).errors()).extracting(ValidationError::kind).containsExactly(ErrorKind.TYPE_MISMATCH);
            assertThat(result.attempts().get(2).isSuccessful()).isTrue();
            assertThat(controller.state()).isEqualTo(RetryState.SUCCEEDED);

            verify(backend, times(3)).invoke(promptCaptor.capture(), any(), any());
            List<List<ChatMessage>> prompts = promptCaptor.getAllValues();

            // first attempt: system + caller message, no feedback
            assertThat(prompts.get(0)).hasSize(2);

            // third attempt replays attempt 2 only
            List<ChatMessage> third = prompts.get(2);
            assertThat(third).hasSize(4);
            assertThat(third.get(2)).isEqualTo(AiMessage.from(AGE_AS_TEXT));
            String feedback = ((UserMessage) third.get(3)).singleText();
            assertThat(feedback).contains("age: expected integer but got string");
            assertThat(feedback).doesNotContain("missing required field");
        }

        @Test
        @DisplayName("should exhaust after two attempts when maxAttempts is 2")
        void exhausts() throws Exception {
            when(backend.invoke(anyList(), any(), any())).thenReturn(MISSING_AGE);
            RetryController<Instance> controller = controller(ExtractionConfig.builder().maxAttempts(2).build());

            ExtractionResult<Instance> result = controller.run(messages);

            assertThat(result).isInstanceOf(ExtractionResult.Exhausted.class);
            ExtractionResult.Exhausted<Instance> exhausted = (ExtractionResult.Exhausted<Instance>) result;
            assertThat(exhausted.attempts()).hasSize(2);
            assertThat(exhausted.lastErrors()).extracting(ValidationError::kind).containsExactly(ErrorKind.MISSING_FIELD);
            assertThat(controller.state()).isEqualTo(RetryState.FAILED);
            verify(backend, times(2)).invoke(anyList(), any(), any());
            verify(listener).onExhausted(eq("User"), anyList());
            assertThatThrownBy(result::orElseThrow)
                    .isInstanceOf(ExtractionFailedException.class)
                    .hasMessageContaining("exhausted after 2 attempt(s)");
        }

        @Test
        @DisplayName("should succeed on the first attempt without feedback")
        void firstTime() throws Exception {
            when(backend.invoke(anyList(), any(), any())).thenReturn(VALID);

            ExtractionResult<Instance> result = controller(ExtractionConfig.defaults()).run(messages);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.attempts()).hasSize(1);
            verify(listener).onAttemptStart("User", 1, 3);
            verify(listener).onSuccess(eq("User"), any(ExtractionAttempt.class));
            verify(listener, never()).onAttemptFailed(any(), any());
        }

        @Test
        @DisplayName("should notify the listener in order")
        void listenerOrder() throws Exception {
            when(backend.invoke(anyList(), any(), any())).thenReturn(MISSING_AGE, VALID);

            controller(ExtractionConfig.defaults()).run(messages);

            InOrder order = inOrder(listener);
            order.verify(listener).onAttemptStart("User", 1, 3);
            order.verify(listener).onAttemptFailed(eq("User"), any(ExtractionAttempt.class));
            order.verify(listener).onAttemptStart("User", 2, 3);
            order.verify(listener).onSuccess(eq("User"), any(ExtractionAttempt.class));
        }
    }

    @Nested
    @DisplayName("Backend failures")
    class BackendFailures {

        @Test
        @DisplayName("should re-invoke transient failures without consuming attempts")
        void transientWithinBudget() throws Exception {
            when(backend.invoke(anyList(), any(), any()))
                    .thenThrow(BackendInvocationException.transientFailure("timeout", null))
                    .thenThrow(BackendInvocationException.transientFailure("timeout", null))
                    .thenReturn(VALID);

            ExtractionResult<Instance> result = controller(ExtractionConfig.builder().backendRetryBudget(2).build())
                    .run(messages);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.attempts()).hasSize(1);
            verify(backend, times(3)).invoke(anyList(), any(), any());
            verify(listener).onBackendRetry(eq("User"), eq(1), eq(1), any(BackendInvocationException.class));
            verify(listener).onBackendRetry(eq("User"), eq(1), eq(0), any(BackendInvocationException.class));
        }

        @Test
        @DisplayName("should fail with BACKEND_FAILURE once the retry budget is spent")
        void budgetSpent() throws Exception {
            BackendInvocationException failure = BackendInvocationException.transientFailure("503", null);
            when(backend.invoke(anyList(), any(), any())).thenThrow(failure);
            RetryController<Instance> controller = controller(ExtractionConfig.builder().backendRetryBudget(1).build());

            ExtractionResult<Instance> result = controller.run(messages);

            assertThat(result).isInstanceOfSatisfying(ExtractionResult.Failed.class, failed -> {
                assertThat(failed.reason()).isEqualTo(FailureReason.BACKEND_FAILURE);
                assertThat(failed.cause()).isSameAs(failure);
                assertThat(failed.attempts()).isEmpty();
            });
            assertThat(controller.state()).isEqualTo(RetryState.FAILED);
            verify(backend, times(2)).invoke(anyList(), any(), any());
        }

        @Test
        @DisplayName("should share the retry budget across attempts")
        void budgetSharedAcrossAttempts() throws Exception {
            when(backend.invoke(anyList(), any(), any()))
                    .thenThrow(BackendInvocationException.transientFailure("blip", null))
                    .thenReturn(MISSING_AGE)
                    .thenThrow(BackendInvocationException.transientFailure("blip again", null));

            ExtractionResult<Instance> result = controller(ExtractionConfig.builder().backendRetryBudget(1).build())
                    .run(messages);

            assertThat(result).isInstanceOfSatisfying(ExtractionResult.Failed.class, failed -> {
                assertThat(failed.reason()).isEqualTo(FailureReason.BACKEND_FAILURE);
                assertThat(failed.attempts()).hasSize(1);
            });
        }

        @Test
        @DisplayName("should fail immediately on a permanent failure")
        void permanent() throws Exception {
            when(backend.invoke(anyList(), any(), any()))
                    .thenThrow(BackendInvocationException.permanentFailure("bad request", null));

            ExtractionResult<Instance> result = controller(ExtractionConfig.defaults()).run(messages);

            assertThat(result).isInstanceOfSatisfying(ExtractionResult.Failed.class,
                    failed -> assertThat(failed.reason()).isEqualTo(FailureReason.BACKEND_FAILURE));
            verify(backend, times(1)).invoke(anyList(), any(), any());
            verify(listener).onFailure(eq("User"), eq(FailureReason.BACKEND_FAILURE), any(BackendInvocationException.class));
        }

        @Test
        @DisplayName("should fail with BACKEND_FAILURE when the backend throws unexpectedly")
        void unexpectedRuntimeException() throws Exception {
            when(backend.invoke(anyList(), any(), any())).thenThrow(new IllegalStateException("bug"));

            ExtractionResult<Instance> result = controller(ExtractionConfig.defaults()).run(messages);

            assertThat(result).isInstanceOfSatisfying(ExtractionResult.Failed.class,
                    failed -> assertThat(failed.cause()).isInstanceOf(IllegalStateException.class));
        }
    }

    @Nested
    @DisplayName("Deadline")
    class Deadline {

        @Test
        @DisplayName("should cancel before the first attempt when the deadline has passed")
        void alreadyExpired() {
            ExtractionConfig config = ExtractionConfig.builder().deadline(NOW).build();

            ExtractionResult<Instance> result = controller(config).run(messages);

            assertThat(result).isInstanceOfSatisfying(ExtractionResult.Failed.class, failed -> {
                assertThat(failed.reason()).isEqualTo(FailureReason.CANCELLED);
                assertThat(failed.attempts()).isEmpty();
                assertThat(failed.cause()).isNull();
            });
            verifyNoInteractions(backend);
        }

        @Test
        @DisplayName("should cancel at the next attempt boundary once the timeout elapses")
        void timeoutBetweenAttempts() throws Exception {
            when(backend.invoke(anyList(), any(), any())).thenAnswer(invocation -> {
                clock.advance(Duration.ofSeconds(11));
                return MISSING_AGE;
            });
            ExtractionConfig config = ExtractionConfig.builder().timeout(Duration.ofSeconds(10)).build();

            ExtractionResult<Instance> result = controller(config).run(messages);

            assertThat(result).isInstanceOfSatisfying(ExtractionResult.Failed.class, failed -> {
                assertThat(failed.reason()).isEqualTo(FailureReason.CANCELLED);
                assertThat(failed.attempts()).hasSize(1);
            });
            verify(backend, times(1)).invoke(anyList(), any(), any());
        }

        @Test
        @DisplayName("should cancel instead of re-invoking after a transient failure past the deadline")
        void timeoutDuringBackendRetry() throws Exception {
            when(backend.invoke(anyList(), any(), any())).thenAnswer(invocation -> {
                clock.advance(Duration.ofMinutes(1));
                throw BackendInvocationException.transientFailure("slow", null);
            });
            ExtractionConfig config = ExtractionConfig.builder().timeout(Duration.ofSeconds(30)).build();

            ExtractionResult<Instance> result = controller(config).run(messages);

            assertThat(result).isInstanceOfSatisfying(ExtractionResult.Failed.class,
                    failed -> assertThat(failed.reason()).isEqualTo(FailureReason.CANCELLED));
            verify(backend, times(1)).invoke(anyList(), any(), any());
        }
    }

    @Test
    void run_shouldRejectSecondRun() throws Exception {
        when(backend.invoke(anyList(), any(), any())).thenReturn(VALID);
        RetryController<Instance> controller = controller(ExtractionConfig.defaults());
        controller.run(messages);

        assertThatThrownBy(() -> controller.run(messages)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void state_shouldStartPending() {
        assertThat(controller(ExtractionConfig.defaults()).state()).isEqualTo(RetryState.PENDING);
        assertThat(RetryState.PENDING.isTerminal()).isFalse();
        assertThat(RetryState.FAILED.isTerminal()).isTrue();
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
