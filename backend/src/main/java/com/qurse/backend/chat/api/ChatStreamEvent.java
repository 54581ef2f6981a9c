package com.qurse.backend.chat.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.qurse.backend.chat.domain.GenerationMetadata;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatStreamEvent(
    String type, UUID conversationId, String delta, GenerationMetadata metadata, String error) {

  public static ChatStreamEvent start(UUID conversationId) {
    return new ChatStreamEvent("start", conversationId, null, null, null);
  }

  public static ChatStreamEvent textDelta(UUID conversationId, String delta) {
    return new ChatStreamEvent("text-delta", conversationId, delta, null, null);
  }

  public static ChatStreamEvent reasoningDelta(UUID conversationId, String delta) {
    return new ChatStreamEvent("reasoning-delta", conversationId, delta, null, null);
  }

  public static ChatStreamEvent finish(UUID conversationId, GenerationMetadata metadata) {
    return new ChatStreamEvent("finish", conversationId, null, metadata, null);
  }

  public static ChatStreamEvent error(UUID conversationId, String message) {
    return new ChatStreamEvent("error", conversationId, null, null, message);
  }
}
