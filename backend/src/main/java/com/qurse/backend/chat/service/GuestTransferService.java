package com.qurse.backend.chat.service;

import com.qurse.backend.chat.api.GuestTransferResponse;
import com.qurse.backend.chat.ratelimit.JdbcRateLimitCounter;
import com.qurse.backend.chat.ratelimit.TieredRateLimiter;
import com.qurse.backend.common.exception.PersistenceFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Hands the history and the quota usage of an anonymous session to the user who just signed in
 * from it. Conversations move with their messages; daily counters are merged window by window.
 */
@Service
@Slf4j
public class GuestTransferService {

  private final ConversationStore conversationStore;
  private final JdbcRateLimitCounter durableRateLimitCounter;

  public GuestTransferService(
      ConversationStore conversationStore, JdbcRateLimitCounter durableRateLimitCounter) {
    this.conversationStore = conversationStore;
    this.durableRateLimitCounter = durableRateLimitCounter;
  }

  @Transactional
  public GuestTransferResponse transfer(String sessionHash, String userId) {
    int conversations = conversationStore.transferGuest(sessionHash, userId);
    int windows;
    try {
      windows =
          durableRateLimitCounter.transfer(
              TieredRateLimiter.sessionSubject(sessionHash), TieredRateLimiter.userSubject(userId));
    } catch (DataAccessException ex) {
      throw new PersistenceFailureException("Failed to transfer guest rate limits", ex);
    }
    if (conversations > 0 || windows > 0) {
      log.info(
          "Transferred guest session to user {}: {} conversations, {} rate limit windows",
          userId,
          conversations,
          windows);
    } else {
      log.debug("No guest data to transfer for user {}", userId);
    }
    return new GuestTransferResponse(conversations, windows);
  }
}
