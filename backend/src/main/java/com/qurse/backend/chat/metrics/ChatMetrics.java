package com.qurse.backend.chat.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.TimeUnit;

public class ChatMetrics {

  private final MeterRegistry meterRegistry;

  public ChatMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordTurn(String state, String model, long durationNanos) {
    meterRegistry.counter("chat.turns", "state", state, "model", model).increment();
    meterRegistry
        .timer("chat.turn.duration", "state", state)
        .record(durationNanos, TimeUnit.NANOSECONDS);
  }

  public void recordAssistantSaveSkipped(String reason) {
    meterRegistry.counter("chat.assistant.save.skipped", "reason", reason).increment();
  }

  public void recordDuplicatesDeleted(int deleted) {
    if (deleted <= 0) {
      return;
    }
    meterRegistry.counter("chat.duplicates.deleted").increment(deleted);
  }

  public void recordRateLimitDecision(String layer, boolean allowed, boolean degraded) {
    meterRegistry
        .counter(
            "chat.ratelimit.decisions",
            "layer",
            layer,
            "allowed",
            Boolean.toString(allowed),
            "degraded",
            Boolean.toString(degraded))
        .increment();
  }

  public void recordPersistenceFailure(String operation) {
    meterRegistry.counter("chat.persistence.failures", "operation", operation).increment();
  }
}
