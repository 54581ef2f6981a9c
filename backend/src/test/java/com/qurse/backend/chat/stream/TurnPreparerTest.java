package com.qurse.backend.chat.stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.knuddels.jtokkit.Encodings;
import com.qurse.backend.chat.access.AccessGate;
import com.qurse.backend.chat.api.ChatMessagePayload;
import com.qurse.backend.chat.api.ChatStreamRequest;
import com.qurse.backend.chat.config.ChatModesProperties;
import com.qurse.backend.chat.config.ChatProvidersProperties;
import com.qurse.backend.chat.config.ContextWindowProperties;
import com.qurse.backend.chat.config.TitleProperties;
import com.qurse.backend.chat.context.ContextTrimmer;
import com.qurse.backend.chat.context.TokenCounter;
import com.qurse.backend.chat.domain.ChatRole;
import com.qurse.backend.chat.domain.ConversationOwner;
import com.qurse.backend.chat.identity.CallerIdentity;
import com.qurse.backend.chat.metrics.ChatMetrics;
import com.qurse.backend.chat.provider.ChatProviderSelection;
import com.qurse.backend.chat.provider.ChatProviderService;
import com.qurse.backend.chat.ratelimit.RateLimitDecision;
import com.qurse.backend.chat.ratelimit.RateLimitLayer;
import com.qurse.backend.chat.service.ChatModeResolver;
import com.qurse.backend.chat.service.ConversationStore;
import com.qurse.backend.chat.service.EnsuredConversation;
import com.qurse.backend.chat.service.MessageWriter;
import com.qurse.backend.chat.validation.ChatRequestValidator;
import com.qurse.backend.common.exception.AccessDeniedException;
import com.qurse.backend.common.exception.PersistenceFailureException;
import com.qurse.backend.common.exception.RateLimitExceededException;
import com.qurse.backend.common.exception.RateLimitInfo;
import com.qurse.backend.common.exception.RequestValidationException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;

@ExtendWith(MockitoExtension.class)
class TurnPreparerTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC);
  private static final Instant RESET = Instant.parse("2025-03-02T00:00:00Z");
  private static final CallerIdentity GUEST =
      CallerIdentity.guest("session-1", "hash-1", "198.51.100.1");
  private static final ChatProviderSelection SELECTION =
      new ChatProviderSelection("openai", "openai/gpt-oss-120b");

  @Mock private ChatProviderService chatProviderService;
  @Mock private AccessGate accessGate;
  @Mock private ConversationStore conversationStore;
  @Mock private MessageWriter messageWriter;

  private final ExecutorService executor = Executors.newSingleThreadExecutor();
  private final ChatProvidersProperties.Model model = new ChatProvidersProperties.Model();
  private SimpleMeterRegistry meterRegistry;
  private TurnPreparer preparer;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    ChatModesProperties modes = new ChatModesProperties();
    ChatModesProperties.Mode chat = new ChatModesProperties.Mode();
    chat.setSystemPrompt("You are a helpful assistant.");
    modes.getRegistry().put("chat", chat);
    preparer =
        new TurnPreparer(
            new ChatRequestValidator(),
            chatProviderService,
            new ChatModeResolver(modes),
            accessGate,
            conversationStore,
            messageWriter,
            new ContextTrimmer(
                new TokenCounter(Encodings.newDefaultEncodingRegistry(), "cl100k_base"),
                new ContextWindowProperties()),
            new TitleProperties(),
            new ChatMetrics(meterRegistry),
            executor,
            CLOCK);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void preparesTurnInGateEnsureSaveOrder() {
    UUID conversationId = UUID.randomUUID();
    RateLimitDecision allowed = RateLimitDecision.fromCount(1, 10, RESET, RateLimitLayer.DATABASE);
    stubModel();
    when(accessGate.enforce(GUEST, model)).thenReturn(allowed);
    when(conversationStore.ensure(
            ConversationOwner.guest("hash-1"), conversationId.toString(), "Why is the sky blue?"))
        .thenReturn(new EnsuredConversation(conversationId, true));
    when(messageWriter.saveUser(eq(conversationId), anyList())).thenReturn(true);

    GenerationTurn turn =
        preparer.prepare(GUEST, request(conversationId.toString(), "Why is the sky blue?"));

    InOrder order = inOrder(accessGate, conversationStore, messageWriter);
    order.verify(accessGate).enforce(GUEST, model);
    order.verify(conversationStore).ensure(any(), anyString(), anyString());
    order.verify(messageWriter).saveUser(eq(conversationId), anyList());

    assertThat(turn.conversationId()).isEqualTo(conversationId);
    assertThat(turn.conversationCreated()).isTrue();
    assertThat(turn.userSaved()).isTrue();
    assertThat(turn.rateLimit()).isEqualTo(allowed);
    assertThat(turn.state()).isEqualTo(TurnState.USER_SAVED);
    assertThat(turn.transitions())
        .containsKeys(TurnState.GATED, TurnState.CONVERSATION_ENSURING, TurnState.USER_SAVED);
    assertThat(turn.request().systemPrompt()).isEqualTo("You are a helpful assistant.");
    assertThat(turn.request().messages()).hasSize(1);
    assertThat(turn.bridge().isCancelled()).isFalse();
  }

  @Test
  void rateLimitedRequestCreatesNothing() {
    stubModel();
    when(accessGate.enforce(GUEST, model))
        .thenThrow(
            new RateLimitExceededException(
                "Daily message limit reached",
                new RateLimitInfo(0, RESET.toEpochMilli(), "database"),
                new HttpHeaders()));

    assertThatThrownBy(() -> preparer.prepare(GUEST, request(null, "Hello")))
        .isInstanceOfSatisfying(
            RateLimitExceededException.class,
            ex -> assertThat(ex.getRateLimitInfo().remaining()).isZero());
    verifyNoInteractions(conversationStore, messageWriter);
  }

  @Test
  void unknownModelIsRejectedBeforeAccessChecks() {
    when(chatProviderService.findSelection("nope/unknown")).thenReturn(Optional.empty());
    ChatStreamRequest request =
        new ChatStreamRequest(null, "nope/unknown", null, List.of(ChatMessagePayload.user("Hi")));

    assertThatThrownBy(() -> preparer.prepare(GUEST, request))
        .isInstanceOf(RequestValidationException.class);
    verifyNoInteractions(accessGate, conversationStore, messageWriter);
  }

  @Test
  void invalidHistoryIsRejectedBeforeAnySideEffect() {
    ChatStreamRequest request =
        new ChatStreamRequest(
            null,
            null,
            null,
            List.of(
                ChatMessagePayload.user("Hi"),
                new ChatMessagePayload(null, ChatRole.ASSISTANT, null, "Hello!")));

    assertThatThrownBy(() -> preparer.prepare(GUEST, request))
        .isInstanceOf(RequestValidationException.class);
    verifyNoInteractions(chatProviderService, accessGate, conversationStore, messageWriter);
  }

  @Test
  void foreignConversationIsRejectedWithoutSavingTheMessage() {
    UUID conversationId = UUID.randomUUID();
    stubModel();
    when(accessGate.enforce(GUEST, model)).thenReturn(RateLimitDecision.unlimited(RESET));
    when(conversationStore.ensure(any(), eq(conversationId.toString()), anyString()))
        .thenThrow(AccessDeniedException.forbidden("Conversation belongs to another user"));

    assertThatThrownBy(() -> preparer.prepare(GUEST, request(conversationId.toString(), "Hi")))
        .isInstanceOf(AccessDeniedException.class);
    verify(messageWriter, never()).saveUser(any(), anyList());
  }

  @Test
  void storeOutageStillPreparesTurnWithoutHistory() {
    UUID conversationId = UUID.randomUUID();
    stubModel();
    when(accessGate.enforce(GUEST, model)).thenReturn(RateLimitDecision.unlimited(RESET));
    when(conversationStore.ensure(any(), anyString(), anyString()))
        .thenThrow(new PersistenceFailureException("down", new IllegalStateException()));

    GenerationTurn turn = preparer.prepare(GUEST, request(conversationId.toString(), "Hi"));

    assertThat(turn.conversationId()).isEqualTo(conversationId);
    assertThat(turn.userSaved()).isFalse();
    assertThat(turn.conversationCreated()).isFalse();
    verify(messageWriter, never()).saveUser(any(), anyList());
    assertThat(meterRegistry.counter("chat.persistence.failures", "operation", "ensure").count())
        .isEqualTo(1.0);
  }

  @Test
  void longFirstMessageGetsTruncatedFallbackTitle() {
    UUID conversationId = UUID.randomUUID();
    String text = "Explain the difference between TCP and UDP with examples of where each is used";
    stubModel();
    when(accessGate.enforce(GUEST, model)).thenReturn(RateLimitDecision.unlimited(RESET));
    when(conversationStore.ensure(any(), eq(null), anyString()))
        .thenReturn(new EnsuredConversation(conversationId, true));
    when(messageWriter.saveUser(eq(conversationId), anyList())).thenReturn(true);

    preparer.prepare(GUEST, request(null, text));

    verify(conversationStore).ensure(any(), eq(null), eq(text.substring(0, 50) + "..."));
  }

  private void stubModel() {
    when(chatProviderService.findSelection(null)).thenReturn(Optional.of(SELECTION));
    when(chatProviderService.model(SELECTION)).thenReturn(model);
  }

  private static ChatStreamRequest request(String conversationId, String text) {
    return new ChatStreamRequest(conversationId, null, null, List.of(ChatMessagePayload.user(text)));
  }
}
