package com.qurse.backend.chat.stream;

import com.qurse.backend.chat.config.ChatProvidersProperties;
import com.qurse.backend.chat.identity.CallerIdentity;
import com.qurse.backend.chat.ratelimit.RateLimitDecision;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import reactor.core.Disposable;

/**
 * Transient unit of work for one chat request. Holds everything the stream phase needs and the
 * time of every state change; never persisted.
 */
public class GenerationTurn {

  private final CallerIdentity identity;
  private final UUID conversationId;
  private final boolean conversationCreated;
  private final boolean userSaved;
  private final String firstUserText;
  private final GenerationRequest request;
  private final ChatProvidersProperties.Model model;
  private final RateLimitDecision rateLimit;
  private final CancellationBridge bridge;
  private final Clock clock;
  private final AtomicReference<TurnState> state;
  private final Map<TurnState, Instant> transitions = new EnumMap<>(TurnState.class);
  private final AtomicReference<Disposable> subscription = new AtomicReference<>();
  private final AtomicReference<TurnEventSink> sink = new AtomicReference<>();
  private final long startedNanos = System.nanoTime();

  GenerationTurn(
      CallerIdentity identity,
      UUID conversationId,
      boolean conversationCreated,
      boolean userSaved,
      String firstUserText,
      GenerationRequest request,
      ChatProvidersProperties.Model model,
      RateLimitDecision rateLimit,
      CancellationBridge bridge,
      Clock clock,
      Map<TurnState, Instant> preparationTransitions) {
    this.identity = identity;
    this.conversationId = conversationId;
    this.conversationCreated = conversationCreated;
    this.userSaved = userSaved;
    this.firstUserText = firstUserText;
    this.request = request;
    this.model = model;
    this.rateLimit = rateLimit;
    this.bridge = bridge;
    this.clock = clock;
    this.transitions.putAll(preparationTransitions);
    this.state = new AtomicReference<>(TurnState.USER_SAVED);
  }

  /** Moves from {@code expected} to {@code next}; false when another path got there first. */
  boolean transition(TurnState expected, TurnState next) {
    if (!state.compareAndSet(expected, next)) {
      return false;
    }
    synchronized (transitions) {
      transitions.put(next, clock.instant());
    }
    return true;
  }

  public TurnState state() {
    return state.get();
  }

  public Map<TurnState, Instant> transitions() {
    synchronized (transitions) {
      return Collections.unmodifiableMap(new EnumMap<>(transitions));
    }
  }

  public Instant streamStartedAt() {
    synchronized (transitions) {
      return transitions.get(TurnState.STREAMING);
    }
  }

  void bind(TurnEventSink eventSink) {
    sink.set(eventSink);
  }

  /** Event sink bound when streaming starts; a no-op sink before that. */
  TurnEventSink sink() {
    TurnEventSink bound = sink.get();
    return bound != null ? bound : TurnEventSink.NOOP;
  }

  void attach(Disposable disposable) {
    subscription.set(disposable);
  }

  void disposeSubscription() {
    Disposable disposable = subscription.getAndSet(null);
    if (disposable != null && !disposable.isDisposed()) {
      disposable.dispose();
    }
  }

  long elapsedNanos() {
    return System.nanoTime() - startedNanos;
  }

  public CallerIdentity identity() {
    return identity;
  }

  public UUID conversationId() {
    return conversationId;
  }

  public boolean conversationCreated() {
    return conversationCreated;
  }

  /** False when the user message could not be stored; the assistant answer is then not stored either. */
  public boolean userSaved() {
    return userSaved;
  }

  public String firstUserText() {
    return firstUserText;
  }

  public GenerationRequest request() {
    return request;
  }

  public ChatProvidersProperties.Model model() {
    return model;
  }

  public RateLimitDecision rateLimit() {
    return rateLimit;
  }

  public CancellationBridge bridge() {
    return bridge;
  }
}
