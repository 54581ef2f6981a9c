package com.qurse.backend.chat.service;

import com.qurse.backend.chat.api.ConversationMessagesResponse;
import com.qurse.backend.chat.api.MessageSaveResponse;
import com.qurse.backend.chat.api.MessageView;
import com.qurse.backend.chat.api.StoppedMessageRequest;
import com.qurse.backend.chat.dedup.DuplicateGuard;
import com.qurse.backend.chat.domain.ChatMessage;
import com.qurse.backend.chat.domain.ChatRole;
import com.qurse.backend.chat.domain.ConversationOwner;
import com.qurse.backend.chat.domain.MessagePart;
import com.qurse.backend.chat.metrics.ChatMetrics;
import com.qurse.backend.chat.persistence.ChatMessageRepository;
import com.qurse.backend.chat.validation.ChatRequestValidator;
import com.qurse.backend.common.exception.ConversationNotFoundException;
import com.qurse.backend.common.exception.PersistenceFailureException;
import com.qurse.backend.common.exception.RequestValidationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Client-facing reads and writes on stored messages outside of a streaming turn. */
@Service
@Slf4j
public class ConversationMessageService {

  public static final int MAX_PAGE_SIZE = 200;

  private final ConversationStore conversationStore;
  private final ChatMessageRepository chatMessageRepository;
  private final MessageWriter messageWriter;
  private final DuplicateGuard duplicateGuard;
  private final ChatRequestValidator validator;
  private final ChatMetrics chatMetrics;

  public ConversationMessageService(
      ConversationStore conversationStore,
      ChatMessageRepository chatMessageRepository,
      MessageWriter messageWriter,
      DuplicateGuard duplicateGuard,
      ChatRequestValidator validator,
      ChatMetrics chatMetrics) {
    this.conversationStore = conversationStore;
    this.chatMessageRepository = chatMessageRepository;
    this.messageWriter = messageWriter;
    this.duplicateGuard = duplicateGuard;
    this.validator = validator;
    this.chatMetrics = chatMetrics;
  }

  /**
   * Stores the partial assistant message a client kept after stopping a stream. Returns a response
   * with {@code saved=false} when the message was empty or a near-identical copy already exists.
   */
  public MessageSaveResponse saveStopped(ConversationOwner owner, StoppedMessageRequest request) {
    UUID conversationId =
        ConversationIds.durable(request.conversationId())
            .orElseThrow(ConversationNotFoundException::new);
    conversationStore.requireOwned(owner, conversationId);
    validator.validateMessage("message", request.message());
    if (request.message().role() != ChatRole.ASSISTANT) {
      throw new RequestValidationException("message.role", "Only assistant messages can be saved");
    }

    List<MessagePart> parts = request.message().effectiveParts();
    if (duplicateGuard.shouldSkip(conversationId, parts)) {
      chatMetrics.recordAssistantSaveSkipped("duplicate");
      return new MessageSaveResponse(true, false);
    }
    boolean saved = messageWriter.saveStopped(conversationId, parts, request.model());
    return new MessageSaveResponse(true, saved);
  }

  @Transactional(readOnly = true)
  public ConversationMessagesResponse history(
      ConversationOwner owner, String conversationId, int limit, int offset) {
    if (limit < 1 || limit > MAX_PAGE_SIZE) {
      throw new RequestValidationException(
          "limit", "limit must be between 1 and " + MAX_PAGE_SIZE);
    }
    if (offset < 0) {
      throw new RequestValidationException("offset", "offset must not be negative");
    }
    UUID id = ConversationIds.durable(conversationId).orElse(null);
    if (id == null) {
      return ConversationMessagesResponse.empty();
    }
    conversationStore.requireOwned(owner, id);
    try {
      long total = chatMessageRepository.countByConversationId(id);
      List<ChatMessage> newestFirst = chatMessageRepository.findNewestPage(id, limit, offset);
      List<MessageView> views = new ArrayList<>(newestFirst.size());
      for (ChatMessage message : newestFirst) {
        views.add(MessageView.from(message));
      }
      Collections.reverse(views);
      return new ConversationMessagesResponse(views, offset + views.size() < total, total);
    } catch (DataAccessException ex) {
      log.error("Failed to read messages for conversation {}", id, ex);
      throw new PersistenceFailureException("Failed to load conversation messages", ex);
    }
  }
}
