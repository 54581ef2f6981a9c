package com.qurse.backend.chat.dedup;

import com.qurse.backend.chat.domain.ChatMessage;
import com.qurse.backend.chat.domain.MessagePart;
import com.qurse.backend.chat.domain.MessageParts;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Assistant message as seen by the duplicate checks.
 *
 * @param id null for a message that has not been saved yet
 */
public record AssistantCandidate(
    UUID id, String text, String reasoning, boolean stopMarker, Instant createdAt) {

  public static AssistantCandidate of(ChatMessage message) {
    List<MessagePart> parts = message.getParts();
    String text = MessageParts.textProjection(parts);
    return new AssistantCandidate(
        message.getId(),
        text,
        MessageParts.reasoningProjection(parts),
        message.isStopped() || MessageParts.containsStopMarker(text),
        message.getCreatedAt());
  }

  public static AssistantCandidate pending(List<MessagePart> parts, Instant createdAt) {
    String text = MessageParts.textProjection(parts);
    return new AssistantCandidate(
        null,
        text,
        MessageParts.reasoningProjection(parts),
        MessageParts.containsStopMarker(text),
        createdAt);
  }
}
