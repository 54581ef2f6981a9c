package com.qurse.backend.chat.ratelimit;

import com.qurse.backend.chat.identity.CallerIdentity;

public interface RateLimiter {

  /** Counts one message for the caller and decides whether it may proceed. */
  RateLimitDecision check(CallerIdentity identity);

  /** Reports the caller's quota without counting anything. */
  RateLimitDecision status(CallerIdentity identity);
}
