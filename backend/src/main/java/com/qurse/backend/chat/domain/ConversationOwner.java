package com.qurse.backend.chat.domain;

import java.util.Objects;
import org.springframework.util.StringUtils;

/**
 * Owner of a conversation: either an authenticated user id or the hash of an anonymous session,
 * never both.
 */
public record ConversationOwner(String userId, String sessionHash) {

  public ConversationOwner {
    boolean hasUser = StringUtils.hasText(userId);
    boolean hasSession = StringUtils.hasText(sessionHash);
    if (hasUser == hasSession) {
      throw new IllegalArgumentException("Exactly one of userId or sessionHash must be set");
    }
  }

  public static ConversationOwner user(String userId) {
    return new ConversationOwner(userId, null);
  }

  public static ConversationOwner guest(String sessionHash) {
    return new ConversationOwner(null, sessionHash);
  }

  public boolean isGuest() {
    return sessionHash != null;
  }

  public boolean owns(Conversation conversation) {
    if (conversation == null) {
      return false;
    }
    if (isGuest()) {
      return conversation.getUserId() == null
          && Objects.equals(sessionHash, conversation.getSessionHash());
    }
    return Objects.equals(userId, conversation.getUserId());
  }

  @Override
  public String toString() {
    return isGuest() ? "guest" : "user:" + userId;
  }
}
