package com.qurse.backend.chat.identity;

import com.qurse.backend.chat.domain.ConversationOwner;

/**
 * Who is calling: an authenticated user, or an anonymous session identified by its hash.
 *
 * @param clientIp best-effort client address, used only by the per-IP guest limit
 */
public record CallerIdentity(
    String userId, boolean entitled, String sessionId, String sessionHash, String clientIp) {

  public static CallerIdentity user(String userId, boolean entitled, String clientIp) {
    return new CallerIdentity(userId, entitled, null, null, clientIp);
  }

  public static CallerIdentity guest(String sessionId, String sessionHash, String clientIp) {
    return new CallerIdentity(null, false, sessionId, sessionHash, clientIp);
  }

  public boolean isAuthenticated() {
    return userId != null;
  }

  public ConversationOwner owner() {
    return isAuthenticated()
        ? ConversationOwner.user(userId)
        : ConversationOwner.guest(sessionHash);
  }
}
