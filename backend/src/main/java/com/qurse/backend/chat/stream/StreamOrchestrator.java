package com.qurse.backend.chat.stream;

import com.qurse.backend.chat.api.ChatStreamEvent;
import com.qurse.backend.chat.context.TokenCounter;
import com.qurse.backend.chat.dedup.DuplicateGuard;
import com.qurse.backend.chat.domain.GenerationMetadata;
import com.qurse.backend.chat.domain.MessagePart;
import com.qurse.backend.chat.domain.ReasoningPart;
import com.qurse.backend.chat.domain.TextPart;
import com.qurse.backend.chat.identity.CallerIdentity;
import com.qurse.backend.chat.metrics.ChatMetrics;
import com.qurse.backend.chat.service.BackgroundTasks;
import com.qurse.backend.chat.service.MessageWriter;
import com.qurse.backend.chat.service.TitleEnricher;
import com.qurse.backend.common.exception.PersistenceFailureException;
import com.qurse.backend.common.exception.ProviderException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;

/**
 * Drives the stream phase of a prepared turn and the decisions that follow it.
 *
 * <p>The turn leaves {@code STREAMING} exactly once, through a compare-and-set on its state:
 * {@code COMPLETED} when the generator finishes, {@code ABORTED} when any cancellation path fires
 * first, {@code ERRORED} on a provider failure. Only a completed turn schedules an assistant save,
 * and the save runs on the background queue after the event stream has been closed.
 */
@Service
@Slf4j
public class StreamOrchestrator {

  private final ChatGenerator chatGenerator;
  private final MessageWriter messageWriter;
  private final DuplicateGuard duplicateGuard;
  private final TitleEnricher titleEnricher;
  private final BackgroundTasks backgroundTasks;
  private final ActiveTurnRegistry activeTurnRegistry;
  private final TokenCounter tokenCounter;
  private final ChatMetrics chatMetrics;
  private final Clock clock;

  public StreamOrchestrator(
      ChatGenerator chatGenerator,
      MessageWriter messageWriter,
      DuplicateGuard duplicateGuard,
      TitleEnricher titleEnricher,
      BackgroundTasks backgroundTasks,
      ActiveTurnRegistry activeTurnRegistry,
      TokenCounter tokenCounter,
      ChatMetrics chatMetrics,
      Clock clock) {
    this.chatGenerator = chatGenerator;
    this.messageWriter = messageWriter;
    this.duplicateGuard = duplicateGuard;
    this.titleEnricher = titleEnricher;
    this.backgroundTasks = backgroundTasks;
    this.activeTurnRegistry = activeTurnRegistry;
    this.tokenCounter = tokenCounter;
    this.chatMetrics = chatMetrics;
    this.clock = clock;
  }

  public void stream(GenerationTurn turn, TurnEventSink sink) {
    if (!turn.transition(TurnState.USER_SAVED, TurnState.STREAMING)) {
      throw new IllegalStateException("Turn already streamed: " + turn.state());
    }
    turn.bind(sink);
    activeTurnRegistry.register(turn);
    UUID conversationId = turn.conversationId();
    log.debug("Turn {} streaming", conversationId);
    if (!sink.send(ChatStreamEvent.start(conversationId))) {
      abort(turn, CancellationCause.REQUEST_ABORT);
      return;
    }

    AssistantBuffer buffer = new AssistantBuffer();
    Disposable subscription =
        chatGenerator
            .stream(turn.request(), turn.bridge())
            .takeUntilOther(turn.bridge().onCancel())
            .subscribe(
                chunk -> onChunk(turn, sink, buffer, chunk),
                error -> onError(turn, sink, error),
                () -> onComplete(turn, sink, buffer));
    turn.attach(subscription);
  }

  /**
   * Signals cancellation for {@code turn}. Returns true when this call moved the turn to {@code
   * ABORTED}. Calls on an aborted turn only record their cause; calls on a turn that already
   * completed or failed do nothing.
   */
  public boolean abort(GenerationTurn turn, CancellationCause cause) {
    if (!turn.transition(TurnState.STREAMING, TurnState.ABORTED)) {
      if (turn.bridge().isCancelled()) {
        turn.bridge().cancel(cause);
      }
      return false;
    }
    turn.bridge().cancel(cause);
    turn.disposeSubscription();
    log.info(
        "Turn {} aborted by {} (signals: {})",
        turn.conversationId(),
        cause,
        turn.bridge().signals());
    turn.sink().complete();
    decide(turn, TurnState.ABORTED, "aborted", null, null);
    return true;
  }

  /** Stops the caller's active turn on {@code conversationId}, if there is one. */
  public boolean stop(CallerIdentity identity, UUID conversationId) {
    return activeTurnRegistry
        .find(conversationId)
        .filter(turn -> turn.identity().owner().equals(identity.owner()))
        .map(turn -> abort(turn, CancellationCause.BRIDGE_ABORT))
        .orElse(false);
  }

  private void onChunk(
      GenerationTurn turn, TurnEventSink sink, AssistantBuffer buffer, GenerationChunk chunk) {
    if (turn.state() != TurnState.STREAMING || turn.bridge().isCancelled()) {
      return;
    }
    UUID conversationId = turn.conversationId();
    switch (chunk.kind()) {
      case TEXT -> {
        buffer.appendText(chunk.text());
        if (!sink.send(ChatStreamEvent.textDelta(conversationId, chunk.text()))) {
          abort(turn, CancellationCause.REQUEST_ABORT);
        }
      }
      case REASONING -> {
        buffer.appendReasoning(chunk.text());
        if (!sink.send(ChatStreamEvent.reasoningDelta(conversationId, chunk.text()))) {
          abort(turn, CancellationCause.REQUEST_ABORT);
        }
      }
      case FINISH -> complete(turn, sink, buffer, chunk.usage());
    }
  }

  private void onComplete(GenerationTurn turn, TurnEventSink sink, AssistantBuffer buffer) {
    if (turn.state() != TurnState.STREAMING) {
      return;
    }
    if (turn.bridge().isCancelled()) {
      abort(turn, turn.bridge().cause().orElse(CancellationCause.REQUEST_ABORT));
      return;
    }
    log.debug("Generator for turn {} ended without a finish chunk", turn.conversationId());
    complete(turn, sink, buffer, null);
  }

  private void onError(GenerationTurn turn, TurnEventSink sink, Throwable error) {
    if (error instanceof GeneratorAbortException) {
      log.warn("Provider aborted turn {}: {}", turn.conversationId(), error.getMessage());
      abort(turn, CancellationCause.GENERATOR_ABORT);
      return;
    }
    if (!turn.transition(TurnState.STREAMING, TurnState.ERRORED)) {
      log.debug("Ignoring error after turn {} ended", turn.conversationId(), error);
      return;
    }
    log.error("Streaming failed for turn {}", turn.conversationId(), error);
    sink.send(ChatStreamEvent.error(turn.conversationId(), ProviderException.PUBLIC_MESSAGE));
    sink.complete();
    decide(turn, TurnState.ERRORED, "errored", null, null);
  }

  private void complete(
      GenerationTurn turn, TurnEventSink sink, AssistantBuffer buffer, GenerationUsage usage) {
    if (!turn.transition(TurnState.STREAMING, TurnState.COMPLETED)) {
      return;
    }
    GenerationMetadata metadata = metadata(turn, buffer, usage);
    sink.send(ChatStreamEvent.finish(turn.conversationId(), metadata));
    sink.complete();
    decide(turn, TurnState.COMPLETED, null, buffer.toParts(), metadata);
  }

  /**
   * Leaves the terminal state. A non-null {@code skipReason} means no assistant save; otherwise
   * the save is handed to the background queue.
   */
  private void decide(
      GenerationTurn turn,
      TurnState terminal,
      String skipReason,
      List<MessagePart> parts,
      GenerationMetadata metadata) {
    turn.transition(terminal, TurnState.ASSISTANT_SAVE_DECISION);
    UUID conversationId = turn.conversationId();
    if (skipReason != null) {
      log.debug("Skipping assistant save for turn {}: {}", conversationId, skipReason);
      chatMetrics.recordAssistantSaveSkipped(skipReason);
    } else {
      backgroundTasks.submit(
          "assistant save for " + conversationId, () -> saveAssistant(turn, parts, metadata));
    }
    if (turn.conversationCreated() && turn.userSaved()) {
      titleEnricher.enrich(conversationId, turn.firstUserText());
    }
    turn.transition(TurnState.ASSISTANT_SAVE_DECISION, TurnState.DONE);
    activeTurnRegistry.unregister(turn);
    chatMetrics.recordTurn(
        terminal.name().toLowerCase(Locale.ROOT),
        turn.request().selection().modelId(),
        turn.elapsedNanos());
    log.info("Turn {} finished: {}", conversationId, terminal);
  }

  void saveAssistant(GenerationTurn turn, List<MessagePart> parts, GenerationMetadata metadata) {
    UUID conversationId = turn.conversationId();
    if (!turn.userSaved()) {
      log.warn("Not saving assistant message for {}: user message was not saved", conversationId);
      chatMetrics.recordAssistantSaveSkipped("user-not-saved");
      return;
    }
    if (parts.isEmpty()) {
      log.debug("Not saving assistant message for {}: no content", conversationId);
      chatMetrics.recordAssistantSaveSkipped("empty");
      return;
    }
    try {
      if (duplicateGuard.shouldSkip(conversationId, parts)) {
        chatMetrics.recordAssistantSaveSkipped("duplicate");
        return;
      }
      messageWriter.saveAssistant(conversationId, parts, metadata);
    } catch (PersistenceFailureException ex) {
      log.error("Failed to save assistant message for conversation {}", conversationId, ex);
      chatMetrics.recordPersistenceFailure("assistant-save");
    }
  }

  private GenerationMetadata metadata(
      GenerationTurn turn, AssistantBuffer buffer, GenerationUsage usage) {
    Instant startedAt = turn.streamStartedAt();
    Double completionTime =
        startedAt != null ? Duration.between(startedAt, clock.instant()).toMillis() / 1000.0 : null;
    String modelId = turn.request().selection().modelId();
    if (usage == null || usage.isEmpty()) {
      usage = estimateUsage(turn, buffer);
    }
    return new GenerationMetadata(
        modelId, completionTime, usage.inputTokens(), usage.outputTokens(), usage.totalTokens());
  }

  private GenerationUsage estimateUsage(GenerationTurn turn, AssistantBuffer buffer) {
    String tokenizer = turn.model().getTokenizer();
    int input = tokenCounter.countMessages(turn.request().messages(), tokenizer);
    int output =
        tokenCounter.count(buffer.text(), tokenizer)
            + tokenCounter.count(buffer.reasoning(), tokenizer);
    return new GenerationUsage(input, output, input + output);
  }

  private static final class AssistantBuffer {
    private final StringBuilder text = new StringBuilder();
    private final StringBuilder reasoning = new StringBuilder();

    void appendText(String value) {
      if (value != null) {
        text.append(value);
      }
    }

    void appendReasoning(String value) {
      if (value != null) {
        reasoning.append(value);
      }
    }

    String text() {
      return text.toString();
    }

    String reasoning() {
      return reasoning.toString();
    }

    List<MessagePart> toParts() {
      List<MessagePart> parts = new ArrayList<>(2);
      if (reasoning.length() > 0) {
        parts.add(new ReasoningPart(reasoning.toString()));
      }
      if (text.length() > 0) {
        parts.add(new TextPart(text.toString()));
      }
      return parts;
    }
  }
}
