package com.qurse.backend.chat.domain;

/** Usage and timing attached to a completed assistant message. */
public record GenerationMetadata(
    String model,
    Double completionTime,
    Integer inputTokens,
    Integer outputTokens,
    Integer totalTokens) {

  public static GenerationMetadata of(String model, Double completionTime) {
    return new GenerationMetadata(model, completionTime, null, null, null);
  }
}
