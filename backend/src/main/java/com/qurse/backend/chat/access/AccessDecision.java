package com.qurse.backend.chat.access;

import com.qurse.backend.chat.ratelimit.RateLimitDecision;
import java.time.Instant;

/**
 * Result of {@link AccessGate#check}. {@code rateLimit} is null when an entitlement check denied
 * the request before the limiter was consulted.
 */
public record AccessDecision(boolean allowed, DenyReason reason, RateLimitDecision rateLimit) {

  static AccessDecision allow(RateLimitDecision rateLimit) {
    return new AccessDecision(true, null, rateLimit);
  }

  static AccessDecision deny(DenyReason reason, RateLimitDecision rateLimit) {
    return new AccessDecision(false, reason, rateLimit);
  }

  public int remaining() {
    return rateLimit != null ? rateLimit.remaining() : 0;
  }

  public Instant resetAt() {
    return rateLimit != null ? rateLimit.resetAt() : null;
  }
}
