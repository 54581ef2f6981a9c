package com.qurse.backend.chat.stream;

import com.qurse.backend.chat.access.AccessGate;
import com.qurse.backend.chat.api.ChatMessagePayload;
import com.qurse.backend.chat.api.ChatStreamRequest;
import com.qurse.backend.chat.config.ChatProvidersProperties;
import com.qurse.backend.chat.config.TitleProperties;
import com.qurse.backend.chat.context.ContextTrimResult;
import com.qurse.backend.chat.context.ContextTrimmer;
import com.qurse.backend.chat.domain.MessageParts;
import com.qurse.backend.chat.identity.CallerIdentity;
import com.qurse.backend.chat.metrics.ChatMetrics;
import com.qurse.backend.chat.provider.ChatProviderSelection;
import com.qurse.backend.chat.provider.ChatProviderService;
import com.qurse.backend.chat.ratelimit.RateLimitDecision;
import com.qurse.backend.chat.service.ChatModeResolver;
import com.qurse.backend.chat.service.ChatModeSelection;
import com.qurse.backend.chat.service.ConversationIds;
import com.qurse.backend.chat.service.ConversationStore;
import com.qurse.backend.chat.service.ConversationTitles;
import com.qurse.backend.chat.service.EnsuredConversation;
import com.qurse.backend.chat.service.MessageWriter;
import com.qurse.backend.chat.validation.ChatRequestValidator;
import com.qurse.backend.common.exception.PersistenceFailureException;
import com.qurse.backend.common.exception.RequestValidationException;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs everything that must happen before the first token: validation, the access gate, the
 * conversation row and the user message. Context trimming runs alongside the store calls.
 *
 * <p>Validation, access and ownership failures throw before any side effect. Store failures are
 * logged and the turn continues without history.
 */
@Component
@Slf4j
public class TurnPreparer {

  private final ChatRequestValidator validator;
  private final ChatProviderService chatProviderService;
  private final ChatModeResolver chatModeResolver;
  private final AccessGate accessGate;
  private final ConversationStore conversationStore;
  private final MessageWriter messageWriter;
  private final ContextTrimmer contextTrimmer;
  private final TitleProperties titleProperties;
  private final ChatMetrics chatMetrics;
  private final ExecutorService executor;
  private final Clock clock;

  public TurnPreparer(
      ChatRequestValidator validator,
      ChatProviderService chatProviderService,
      ChatModeResolver chatModeResolver,
      AccessGate accessGate,
      ConversationStore conversationStore,
      MessageWriter messageWriter,
      ContextTrimmer contextTrimmer,
      TitleProperties titleProperties,
      ChatMetrics chatMetrics,
      @Qualifier("chatBackgroundExecutor") ExecutorService executor,
      Clock clock) {
    this.validator = validator;
    this.chatProviderService = chatProviderService;
    this.chatModeResolver = chatModeResolver;
    this.accessGate = accessGate;
    this.conversationStore = conversationStore;
    this.messageWriter = messageWriter;
    this.contextTrimmer = contextTrimmer;
    this.titleProperties = titleProperties;
    this.chatMetrics = chatMetrics;
    this.executor = executor;
    this.clock = clock;
  }

  public GenerationTurn prepare(CallerIdentity identity, ChatStreamRequest request) {
    validator.validate(request);
    ChatProviderSelection selection =
        chatProviderService
            .findSelection(request.model())
            .orElseThrow(
                () ->
                    new RequestValidationException(
                        "model", "Invalid model name. Model must exist in the model registry."));
    ChatProvidersProperties.Model model = chatProviderService.model(selection);
    if (!model.isStreamingEnabled()) {
      throw new RequestValidationException(
          "model", "Model '" + selection.modelId() + "' does not support streaming responses");
    }
    ChatModeSelection mode = chatModeResolver.resolve(request.chatMode());

    Map<TurnState, Instant> transitions = new EnumMap<>(TurnState.class);
    RateLimitDecision rateLimit = accessGate.enforce(identity, model);
    transitions.put(TurnState.GATED, clock.instant());

    List<ChatMessagePayload> messages = request.messages();
    ChatMessagePayload userMessage = messages.get(messages.size() - 1);
    String userText = MessageParts.textProjection(userMessage.effectiveParts());

    CompletableFuture<ContextTrimResult> context = trimAsync(messages, model);
    transitions.put(TurnState.CONVERSATION_ENSURING, clock.instant());
    UUID conversationId = null;
    boolean created = false;
    boolean userSaved = false;
    try {
      EnsuredConversation ensured =
          conversationStore.ensure(
              identity.owner(),
              request.conversationId(),
              ConversationTitles.fallback(userText, titleProperties.getFallbackLength()));
      conversationId = ensured.id();
      created = ensured.created();
      userSaved = messageWriter.saveUser(conversationId, userMessage.effectiveParts());
    } catch (PersistenceFailureException ex) {
      log.warn(
          "Continuing without history for conversation {}: {}",
          conversationId != null ? conversationId : request.conversationId(),
          ex.getMessage(),
          ex);
      chatMetrics.recordPersistenceFailure(conversationId == null ? "ensure" : "user-save");
    } catch (RuntimeException ex) {
      context.cancel(true);
      throw ex;
    }
    if (conversationId == null) {
      conversationId =
          ConversationIds.durable(request.conversationId()).orElseGet(UUID::randomUUID);
    }
    transitions.put(TurnState.USER_SAVED, clock.instant());

    ContextTrimResult trimmed = awaitContext(context, messages);
    log.debug(
        "Prepared turn for conversation {} (model={}, mode={}, created={}, userSaved={}, tools={})",
        conversationId,
        selection.modelId(),
        mode.id(),
        created,
        userSaved,
        mode.enabledTools());
    return new GenerationTurn(
        identity,
        conversationId,
        created,
        userSaved,
        userText,
        new GenerationRequest(selection, mode.systemPrompt(), trimmed.messages()),
        model,
        rateLimit,
        new CancellationBridge(clock, conversationId.toString()),
        clock,
        transitions);
  }

  private CompletableFuture<ContextTrimResult> trimAsync(
      List<ChatMessagePayload> messages, ChatProvidersProperties.Model model) {
    try {
      return CompletableFuture.supplyAsync(() -> contextTrimmer.trim(messages, model), executor);
    } catch (RejectedExecutionException rejected) {
      log.debug("Background queue full, trimming context inline");
      return CompletableFuture.completedFuture(contextTrimmer.trim(messages, model));
    }
  }

  private ContextTrimResult awaitContext(
      CompletableFuture<ContextTrimResult> context, List<ChatMessagePayload> messages) {
    try {
      return context.join();
    } catch (CompletionException ex) {
      log.warn("Context trimming failed, sending the full history", ex.getCause());
      return new ContextTrimResult(messages, 0, 0, 0, 0);
    }
  }
}
