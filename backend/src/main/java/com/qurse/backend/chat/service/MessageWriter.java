package com.qurse.backend.chat.service;

import com.qurse.backend.chat.domain.ChatMessage;
import com.qurse.backend.chat.domain.ChatRole;
import com.qurse.backend.chat.domain.Conversation;
import com.qurse.backend.chat.domain.GenerationMetadata;
import com.qurse.backend.chat.domain.MessagePart;
import com.qurse.backend.chat.domain.MessageParts;
import com.qurse.backend.chat.persistence.ChatMessageRepository;
import com.qurse.backend.chat.persistence.ConversationRepository;
import com.qurse.backend.common.exception.PersistenceFailureException;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;

/**
 * Persists single messages. The plain-text projection is derived here, once, from the text parts
 * and stored next to them.
 */
@Service
@Slf4j
public class MessageWriter {

  private final ChatMessageRepository chatMessageRepository;
  private final ConversationRepository conversationRepository;
  private final Clock clock;

  public MessageWriter(
      ChatMessageRepository chatMessageRepository,
      ConversationRepository conversationRepository,
      Clock clock) {
    this.chatMessageRepository = chatMessageRepository;
    this.conversationRepository = conversationRepository;
    this.clock = clock;
  }

  /** Returns false without writing when {@code parts} is empty. */
  public boolean saveUser(UUID conversationId, List<MessagePart> parts) {
    return save(conversationId, ChatRole.USER, parts, null, false);
  }

  /** Returns false without writing when {@code parts} is empty. */
  public boolean saveAssistant(
      UUID conversationId, List<MessagePart> parts, GenerationMetadata metadata) {
    return save(conversationId, ChatRole.ASSISTANT, parts, metadata, false);
  }

  /**
   * Persists the partial assistant message a client kept after stopping a generation. The row is
   * flagged as stopped when its text carries the stop marker.
   */
  public boolean saveStopped(UUID conversationId, List<MessagePart> parts, String model) {
    return save(conversationId, ChatRole.ASSISTANT, parts, GenerationMetadata.of(model, null), true);
  }

  private boolean save(
      UUID conversationId,
      ChatRole role,
      List<MessagePart> parts,
      GenerationMetadata metadata,
      boolean detectStop) {
    Assert.notNull(conversationId, "conversationId must not be null");
    if (parts == null || parts.isEmpty()) {
      log.debug("Skipping {} message for conversation {}: no parts", role, conversationId);
      return false;
    }

    String content = MessageParts.textProjection(parts);
    try {
      Conversation conversation = conversationRepository.getReferenceById(conversationId);
      ChatMessage message = new ChatMessage(conversation, role, parts, content);
      if (role == ChatRole.ASSISTANT) {
        message.applyGeneration(metadata);
      }
      if (detectStop && MessageParts.containsStopMarker(content)) {
        message.markStopped();
      }
      chatMessageRepository.save(message);
      conversationRepository.touch(conversationId, clock.instant());
    } catch (DataAccessException ex) {
      throw new PersistenceFailureException(
          "Failed to save " + role.wireName() + " message for conversation " + conversationId, ex);
    }
    log.debug("Saved {} message for conversation {}", role.wireName(), conversationId);
    return true;
  }
}
