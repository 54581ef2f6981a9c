package com.qurse.backend.chat.service;

import com.qurse.backend.chat.domain.Conversation;
import com.qurse.backend.chat.domain.ConversationOwner;
import com.qurse.backend.chat.persistence.ConversationRepository;
import com.qurse.backend.common.exception.AccessDeniedException;
import com.qurse.backend.common.exception.ConversationNotFoundException;
import com.qurse.backend.common.exception.PersistenceFailureException;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;

/**
 * Creates conversation rows and fences them by owner. The primary key is the only concurrency
 * control: concurrent creators insert, and the losers re-read the winner's row and verify it.
 */
@Service
@Slf4j
public class ConversationStore {

  static final String OWNERSHIP_MESSAGE = "Conversation belongs to another user";

  private final ConversationRepository conversationRepository;

  public ConversationStore(ConversationRepository conversationRepository) {
    this.conversationRepository = conversationRepository;
  }

  /**
   * Returns the durable id of the caller's conversation, creating the row when needed. Absent or
   * placeholder ids always produce a new row under a server-generated id.
   *
   * @throws AccessDeniedException when the conversation exists under a different owner
   * @throws PersistenceFailureException when the store cannot be reached
   */
  public EnsuredConversation ensure(ConversationOwner owner, String conversationId, String title) {
    Optional<UUID> durableId = ConversationIds.durable(conversationId);
    if (durableId.isEmpty()) {
      UUID generatedId = UUID.randomUUID();
      insert(new Conversation(generatedId, owner, title));
      log.debug("Created conversation {} for {}", generatedId, owner);
      return new EnsuredConversation(generatedId, true);
    }

    UUID id = durableId.get();
    try {
      Optional<Conversation> existing = conversationRepository.findById(id);
      if (existing.isPresent()) {
        verifyOwner(owner, existing.get());
        return new EnsuredConversation(id, false);
      }
    } catch (DataAccessException ex) {
      throw new PersistenceFailureException("Failed to load conversation " + id, ex);
    }

    try {
      insert(new Conversation(id, owner, title));
      log.debug("Created conversation {} for {}", id, owner);
      return new EnsuredConversation(id, true);
    } catch (DataIntegrityViolationException conflict) {
      log.debug("Conversation {} was created concurrently, verifying owner", id);
      Conversation winner =
          conversationRepository
              .findById(id)
              .orElseThrow(
                  () ->
                      new PersistenceFailureException(
                          "Conversation " + id + " conflicted but could not be re-read", conflict));
      verifyOwner(owner, winner);
      return new EnsuredConversation(id, false);
    }
  }

  /**
   * Moves the conversations of an anonymous session to a signed-in user. Conversations owned by a
   * user are left untouched. Returns the number of conversations moved.
   */
  public int transferGuest(String sessionHash, String userId) {
    Assert.hasText(sessionHash, "sessionHash must not be empty");
    Assert.hasText(userId, "userId must not be empty");
    try {
      return conversationRepository.transferGuest(sessionHash, userId);
    } catch (DataAccessException ex) {
      throw new PersistenceFailureException("Failed to transfer guest conversations", ex);
    }
  }

  /**
   * Loads a conversation for reading. Missing and foreign conversations are indistinguishable to
   * the caller.
   */
  public Conversation requireOwned(ConversationOwner owner, UUID conversationId) {
    Conversation conversation =
        conversationRepository.findById(conversationId).orElseThrow(ConversationNotFoundException::new);
    if (!owner.owns(conversation)) {
      throw new ConversationNotFoundException();
    }
    return conversation;
  }

  private void insert(Conversation conversation) {
    try {
      conversationRepository.saveAndFlush(conversation);
    } catch (DataIntegrityViolationException conflict) {
      throw conflict;
    } catch (DataAccessException ex) {
      throw new PersistenceFailureException(
          "Failed to create conversation " + conversation.getId(), ex);
    }
  }

  private void verifyOwner(ConversationOwner owner, Conversation conversation) {
    if (!owner.owns(conversation)) {
      log.warn("Rejected access to conversation {} by {}", conversation.getId(), owner);
      throw AccessDeniedException.forbidden(OWNERSHIP_MESSAGE);
    }
  }
}
