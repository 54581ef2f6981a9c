package com.qurse.backend.chat.api;

import com.qurse.backend.chat.domain.ChatMessage;
import com.qurse.backend.chat.domain.ChatRole;
import com.qurse.backend.chat.domain.GenerationMetadata;
import com.qurse.backend.chat.domain.MessagePart;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record MessageView(
    UUID id,
    ChatRole role,
    List<MessagePart> parts,
    String content,
    boolean isStopped,
    GenerationMetadata metadata,
    Instant createdAt) {

  public static MessageView from(ChatMessage message) {
    GenerationMetadata metadata =
        message.getRole() == ChatRole.ASSISTANT
            ? new GenerationMetadata(
                message.getModel(),
                message.getCompletionTime(),
                message.getInputTokens(),
                message.getOutputTokens(),
                message.getTotalTokens())
            : null;
    return new MessageView(
        message.getId(),
        message.getRole(),
        message.getParts(),
        message.getContent(),
        message.isStopped(),
        metadata,
        message.getCreatedAt());
  }
}
