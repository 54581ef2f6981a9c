package com.qurse.backend.chat.ratelimit;

import org.springframework.http.HttpHeaders;

public final class RateLimitHeaders {

  public static final String LIMIT = "X-RateLimit-Limit";
  public static final String REMAINING = "X-RateLimit-Remaining";
  public static final String RESET = "X-RateLimit-Reset";
  public static final String LAYER = "X-RateLimit-Layer";
  public static final String DEGRADED = "X-RateLimit-Degraded";

  private static final String UNLIMITED = "unlimited";

  private RateLimitHeaders() {}

  public static HttpHeaders from(RateLimitDecision decision) {
    HttpHeaders headers = new HttpHeaders();
    if (decision == null) {
      return headers;
    }
    headers.set(LIMIT, decision.isUnlimited() ? UNLIMITED : Integer.toString(decision.limit()));
    headers.set(
        REMAINING, decision.isUnlimited() ? UNLIMITED : Integer.toString(decision.remaining()));
    if (decision.resetAt() != null) {
      headers.set(RESET, Long.toString(decision.resetAt().toEpochMilli()));
    }
    headers.set(LAYER, decision.layer().wireName());
    if (decision.degraded()) {
      headers.set(DEGRADED, "true");
    }
    return headers;
  }
}
