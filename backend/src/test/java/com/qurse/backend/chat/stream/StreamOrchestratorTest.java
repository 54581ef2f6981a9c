package com.qurse.backend.chat.stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.knuddels.jtokkit.Encodings;
import com.qurse.backend.chat.api.ChatMessagePayload;
import com.qurse.backend.chat.api.ChatStreamEvent;
import com.qurse.backend.chat.config.ChatProvidersProperties;
import com.qurse.backend.chat.context.TokenCounter;
import com.qurse.backend.chat.dedup.DuplicateGuard;
import com.qurse.backend.chat.domain.GenerationMetadata;
import com.qurse.backend.chat.domain.MessagePart;
import com.qurse.backend.chat.domain.ReasoningPart;
import com.qurse.backend.chat.domain.TextPart;
import com.qurse.backend.chat.identity.CallerIdentity;
import com.qurse.backend.chat.metrics.ChatMetrics;
import com.qurse.backend.chat.provider.ChatProviderSelection;
import com.qurse.backend.chat.ratelimit.RateLimitDecision;
import com.qurse.backend.chat.service.BackgroundTasks;
import com.qurse.backend.chat.service.MessageWriter;
import com.qurse.backend.chat.service.TitleEnricher;
import com.qurse.backend.common.exception.PersistenceFailureException;
import com.qurse.backend.common.exception.ProviderException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

@ExtendWith(MockitoExtension.class)
class StreamOrchestratorTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC);
  private static final String MODEL_ID = "openai/gpt-oss-120b";
  private static final CallerIdentity OWNER = CallerIdentity.user("user-1", false, "198.51.100.1");

  @Mock private ChatGenerator chatGenerator;
  @Mock private MessageWriter messageWriter;
  @Mock private DuplicateGuard duplicateGuard;
  @Mock private TitleEnricher titleEnricher;
  @Mock private BackgroundTasks backgroundTasks;

  private SimpleMeterRegistry meterRegistry;
  private ActiveTurnRegistry registry;
  private StreamOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    registry = new ActiveTurnRegistry();
    orchestrator =
        new StreamOrchestrator(
            chatGenerator,
            messageWriter,
            duplicateGuard,
            titleEnricher,
            backgroundTasks,
            registry,
            new TokenCounter(Encodings.newDefaultEncodingRegistry(), "cl100k_base"),
            new ChatMetrics(meterRegistry),
            CLOCK);
    lenient()
        .doAnswer(
            invocation -> {
              invocation.<Runnable>getArgument(1).run();
              return null;
            })
        .when(backgroundTasks)
        .submit(anyString(), any(Runnable.class));
  }

  @Test
  void completedTurnStreamsAndSavesAssistantAfterwards() {
    GenerationTurn turn = turn(true, true);
    when(chatGenerator.stream(turn.request(), turn.bridge()))
        .thenReturn(
            Flux.just(
                GenerationChunk.reasoning("adding"),
                GenerationChunk.text("2 + 2 "),
                GenerationChunk.text("= 4"),
                GenerationChunk.finish(new GenerationUsage(12, 5, 17))));
    when(messageWriter.saveAssistant(any(UUID.class), anyList(), any(GenerationMetadata.class)))
        .thenReturn(true);
    RecordingEventSink sink = new RecordingEventSink();

    orchestrator.stream(turn, sink);

    assertThat(sink.types())
        .containsExactly("start", "reasoning-delta", "text-delta", "text-delta", "finish");
    assertThat(sink.completions()).isEqualTo(1);
    GenerationMetadata finish = sink.events().get(4).metadata();
    assertThat(finish.model()).isEqualTo(MODEL_ID);
    assertThat(finish.totalTokens()).isEqualTo(17);

    List<MessagePart> expectedParts = List.of(new ReasoningPart("adding"), new TextPart("2 + 2 = 4"));
    InOrder order = inOrder(duplicateGuard, messageWriter, titleEnricher);
    order.verify(duplicateGuard).shouldSkip(turn.conversationId(), expectedParts);
    order.verify(messageWriter).saveAssistant(turn.conversationId(), expectedParts, finish);
    order.verify(titleEnricher).enrich(turn.conversationId(), "What is 2 + 2?");

    assertThat(turn.state()).isEqualTo(TurnState.DONE);
    assertThat(turn.transitions()).containsKeys(TurnState.STREAMING, TurnState.COMPLETED);
    assertThat(registry.find(turn.conversationId())).isEmpty();
    assertThat(meterRegistry.counter("chat.turns", "state", "completed", "model", MODEL_ID).count())
        .isEqualTo(1.0);
  }

  @Test
  void clientAbortAfterTwoChunksPersistsNothing() {
    GenerationTurn turn = turn(true, true);
    Sinks.Many<GenerationChunk> upstream = Sinks.many().unicast().onBackpressureBuffer();
    when(chatGenerator.stream(turn.request(), turn.bridge())).thenReturn(upstream.asFlux());
    RecordingEventSink sink = new RecordingEventSink();

    orchestrator.stream(turn, sink);
    upstream.tryEmitNext(GenerationChunk.text("Once upon "));
    upstream.tryEmitNext(GenerationChunk.text("a time"));
    boolean aborted = orchestrator.abort(turn, CancellationCause.REQUEST_ABORT);
    upstream.tryEmitNext(GenerationChunk.text(" there was"));
    upstream.tryEmitNext(GenerationChunk.finish(null));

    assertThat(aborted).isTrue();
    assertThat(sink.types()).containsExactly("start", "text-delta", "text-delta");
    assertThat(sink.completions()).isEqualTo(1);
    assertThat(turn.bridge().cause()).contains(CancellationCause.REQUEST_ABORT);
    assertThat(turn.transitions()).containsKey(TurnState.ABORTED).doesNotContainKey(TurnState.COMPLETED);
    assertThat(turn.state()).isEqualTo(TurnState.DONE);
    verify(messageWriter, never()).saveAssistant(any(), anyList(), any());
    verify(backgroundTasks, never()).submit(anyString(), any(Runnable.class));
    assertThat(meterRegistry.counter("chat.assistant.save.skipped", "reason", "aborted").count())
        .isEqualTo(1.0);
  }

  @Test
  void secondAbortSignalIsRecordedButChangesNothing() {
    GenerationTurn turn = turn(false, true);
    when(chatGenerator.stream(turn.request(), turn.bridge())).thenReturn(Flux.never());
    orchestrator.stream(turn, new RecordingEventSink());

    assertThat(orchestrator.abort(turn, CancellationCause.BRIDGE_ABORT)).isTrue();
    assertThat(orchestrator.abort(turn, CancellationCause.REQUEST_ABORT)).isFalse();

    assertThat(turn.bridge().cause()).contains(CancellationCause.BRIDGE_ABORT);
    assertThat(turn.bridge().signals())
        .containsKeys(CancellationCause.BRIDGE_ABORT, CancellationCause.REQUEST_ABORT);
    assertThat(meterRegistry.counter("chat.turns", "state", "aborted", "model", MODEL_ID).count())
        .isEqualTo(1.0);
  }

  @Test
  void disconnectedClientAbortsTheTurn() {
    GenerationTurn turn = turn(true, true);
    when(chatGenerator.stream(turn.request(), turn.bridge()))
        .thenReturn(
            Flux.just(
                GenerationChunk.text("one"),
                GenerationChunk.text("two"),
                GenerationChunk.finish(null)));
    RecordingEventSink sink = new RecordingEventSink(2);

    orchestrator.stream(turn, sink);

    assertThat(sink.types()).containsExactly("start", "text-delta");
    assertThat(turn.bridge().cause()).contains(CancellationCause.REQUEST_ABORT);
    verify(messageWriter, never()).saveAssistant(any(), anyList(), any());
  }

  @Test
  void providerErrorEndsWithGenericErrorEventAndNoSave() {
    GenerationTurn turn = turn(true, true);
    when(chatGenerator.stream(turn.request(), turn.bridge()))
        .thenReturn(
            Flux.concat(
                Flux.just(GenerationChunk.text("Partial")),
                Flux.error(new ProviderException(new IllegalStateException("upstream 500")))));
    RecordingEventSink sink = new RecordingEventSink();

    orchestrator.stream(turn, sink);

    assertThat(sink.types()).containsExactly("start", "text-delta", "error");
    ChatStreamEvent error = sink.events().get(2);
    assertThat(error.error()).isEqualTo(ProviderException.PUBLIC_MESSAGE);
    assertThat(turn.transitions()).containsKey(TurnState.ERRORED);
    verify(messageWriter, never()).saveAssistant(any(), anyList(), any());
    assertThat(meterRegistry.counter("chat.assistant.save.skipped", "reason", "errored").count())
        .isEqualTo(1.0);
  }

  @Test
  void generatorAbortIsTreatedAsCancellation() {
    GenerationTurn turn = turn(true, true);
    when(chatGenerator.stream(turn.request(), turn.bridge()))
        .thenReturn(Flux.error(new GeneratorAbortException("credentials rejected", null)));
    RecordingEventSink sink = new RecordingEventSink();

    orchestrator.stream(turn, sink);

    assertThat(turn.bridge().cause()).contains(CancellationCause.GENERATOR_ABORT);
    assertThat(turn.transitions()).containsKey(TurnState.ABORTED);
    assertThat(sink.types()).containsExactly("start");
    verify(messageWriter, never()).saveAssistant(any(), anyList(), any());
  }

  @Test
  void missingProviderUsageIsEstimated() {
    GenerationTurn turn = turn(false, true);
    when(chatGenerator.stream(turn.request(), turn.bridge()))
        .thenReturn(Flux.just(GenerationChunk.text("The answer is four.")));
    RecordingEventSink sink = new RecordingEventSink();

    orchestrator.stream(turn, sink);

    GenerationMetadata metadata = sink.events().get(sink.events().size() - 1).metadata();
    assertThat(metadata.inputTokens()).isPositive();
    assertThat(metadata.outputTokens()).isPositive();
    assertThat(metadata.totalTokens()).isEqualTo(metadata.inputTokens() + metadata.outputTokens());
    verify(titleEnricher, never()).enrich(any(), any());
  }

  @Test
  void assistantIsNotSavedWhenUserMessageWasLost() {
    GenerationTurn turn = turn(true, false);
    when(chatGenerator.stream(turn.request(), turn.bridge()))
        .thenReturn(Flux.just(GenerationChunk.text("Hello"), GenerationChunk.finish(null)));

    orchestrator.stream(turn, new RecordingEventSink());

    verify(messageWriter, never()).saveAssistant(any(), anyList(), any());
    verify(titleEnricher, never()).enrich(any(), any());
    assertThat(meterRegistry.counter("chat.assistant.save.skipped", "reason", "user-not-saved").count())
        .isEqualTo(1.0);
  }

  @Test
  void duplicateAnswerIsNotSaved() {
    GenerationTurn turn = turn(false, true);
    when(chatGenerator.stream(turn.request(), turn.bridge()))
        .thenReturn(Flux.just(GenerationChunk.text("Hello"), GenerationChunk.finish(null)));
    when(duplicateGuard.shouldSkip(eq(turn.conversationId()), anyList())).thenReturn(true);

    orchestrator.stream(turn, new RecordingEventSink());

    verify(messageWriter, never()).saveAssistant(any(), anyList(), any());
    assertThat(meterRegistry.counter("chat.assistant.save.skipped", "reason", "duplicate").count())
        .isEqualTo(1.0);
  }

  @Test
  void assistantSaveFailureIsContained() {
    GenerationTurn turn = turn(false, true);
    when(chatGenerator.stream(turn.request(), turn.bridge()))
        .thenReturn(Flux.just(GenerationChunk.text("Hello"), GenerationChunk.finish(null)));
    when(messageWriter.saveAssistant(any(UUID.class), anyList(), any(GenerationMetadata.class)))
        .thenThrow(new PersistenceFailureException("down", new IllegalStateException()));
    RecordingEventSink sink = new RecordingEventSink();

    orchestrator.stream(turn, sink);

    assertThat(sink.types()).endsWith("finish");
    assertThat(turn.state()).isEqualTo(TurnState.DONE);
    assertThat(meterRegistry.counter("chat.persistence.failures", "operation", "assistant-save").count())
        .isEqualTo(1.0);
  }

  @Test
  void stopOnlyReachesTheOwnersTurn() {
    GenerationTurn turn = turn(false, true);
    when(chatGenerator.stream(turn.request(), turn.bridge())).thenReturn(Flux.never());
    orchestrator.stream(turn, new RecordingEventSink());

    CallerIdentity stranger = CallerIdentity.guest("s-2", "hash-2", "198.51.100.2");
    assertThat(orchestrator.stop(stranger, turn.conversationId())).isFalse();
    assertThat(orchestrator.stop(OWNER, UUID.randomUUID())).isFalse();
    assertThat(orchestrator.stop(OWNER, turn.conversationId())).isTrue();
    assertThat(turn.bridge().cause()).contains(CancellationCause.BRIDGE_ABORT);
    assertThat(registry.find(turn.conversationId())).isEmpty();
  }

  private GenerationTurn turn(boolean created, boolean userSaved) {
    UUID conversationId = UUID.randomUUID();
    ChatProvidersProperties.Model model = new ChatProvidersProperties.Model();
    model.setContextWindow(131_072);
    GenerationRequest request =
        new GenerationRequest(
            new ChatProviderSelection("openai", MODEL_ID),
            "You are a helpful assistant.",
            List.of(ChatMessagePayload.user("What is 2 + 2?")));
    return new GenerationTurn(
        OWNER,
        conversationId,
        created,
        userSaved,
        "What is 2 + 2?",
        request,
        model,
        RateLimitDecision.unlimited(Instant.parse("2025-03-02T00:00:00Z")),
        new CancellationBridge(CLOCK, conversationId.toString()),
        CLOCK,
        Map.of(TurnState.USER_SAVED, CLOCK.instant()));
  }
}
