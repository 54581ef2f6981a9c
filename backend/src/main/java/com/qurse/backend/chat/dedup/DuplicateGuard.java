package com.qurse.backend.chat.dedup;

import com.qurse.backend.chat.config.DuplicateDetectionProperties;
import com.qurse.backend.chat.domain.ChatMessage;
import com.qurse.backend.chat.domain.ChatRole;
import com.qurse.backend.chat.domain.MessagePart;
import com.qurse.backend.chat.persistence.ChatMessageRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Inline duplicate check run right before an assistant save. Only the latest assistant message
 * of the conversation is consulted, and only when it was written within the pairing window.
 */
@Component
@Slf4j
public class DuplicateGuard {

  private final ChatMessageRepository chatMessageRepository;
  private final DuplicateResolver duplicateResolver;
  private final DuplicateDetectionProperties properties;
  private final Clock clock;

  public DuplicateGuard(
      ChatMessageRepository chatMessageRepository,
      DuplicateResolver duplicateResolver,
      DuplicateDetectionProperties properties,
      Clock clock) {
    this.chatMessageRepository = chatMessageRepository;
    this.duplicateResolver = duplicateResolver;
    this.properties = properties;
    this.clock = clock;
  }

  /** True when {@code parts} repeat the latest stored assistant message and must not be saved. */
  public boolean shouldSkip(UUID conversationId, List<MessagePart> parts) {
    Optional<ChatMessage> latest =
        chatMessageRepository.findTopByConversationIdAndRoleOrderByCreatedAtDesc(
            conversationId, ChatRole.ASSISTANT);
    if (latest.isEmpty()) {
      return false;
    }
    ChatMessage previous = latest.get();
    Instant now = clock.instant();
    if (previous.getCreatedAt() == null
        || Duration.between(previous.getCreatedAt(), now).abs().compareTo(properties.getWindow())
            > 0) {
      return false;
    }
    AssistantCandidate candidate = AssistantCandidate.pending(parts, now);
    boolean duplicate = duplicateResolver.isDuplicate(AssistantCandidate.of(previous), candidate);
    if (duplicate) {
      log.info(
          "Skipping assistant save for conversation {}: duplicate of message {}",
          conversationId,
          previous.getId());
    }
    return duplicate;
  }
}
