package com.qurse.backend.chat.stream;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Single cancellation token for one turn. Every abort path signals here; the first cause wins
 * and later signals are only recorded. Cancelling is monotonic and safe to repeat.
 */
@Slf4j
public class CancellationBridge {

  private final AtomicReference<CancellationCause> firstCause = new AtomicReference<>();
  private final Map<CancellationCause, Instant> signals = new EnumMap<>(CancellationCause.class);
  private final Sinks.One<CancellationCause> signal = Sinks.one();
  private final Clock clock;
  private final String label;

  public CancellationBridge(Clock clock, String label) {
    this.clock = clock;
    this.label = label;
  }

  /** Returns true only for the call that actually cancelled the turn. */
  public boolean cancel(CancellationCause cause) {
    synchronized (signals) {
      signals.putIfAbsent(cause, clock.instant());
    }
    if (firstCause.compareAndSet(null, cause)) {
      log.debug("Turn {} cancelled: {}", label, cause);
      signal.tryEmitValue(cause);
      return true;
    }
    log.debug("Turn {} already cancelled by {}, ignoring {}", label, firstCause.get(), cause);
    return false;
  }

  public boolean isCancelled() {
    return firstCause.get() != null;
  }

  public Optional<CancellationCause> cause() {
    return Optional.ofNullable(firstCause.get());
  }

  /** When each cause was first signalled, including those that arrived after the first. */
  public Map<CancellationCause, Instant> signals() {
    synchronized (signals) {
      return Collections.unmodifiableMap(new EnumMap<>(signals));
    }
  }

  /** Emits the winning cause once the turn is cancelled. */
  public Mono<CancellationCause> onCancel() {
    return signal.asMono();
  }
}
