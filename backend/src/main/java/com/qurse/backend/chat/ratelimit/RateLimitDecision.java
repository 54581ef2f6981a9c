package com.qurse.backend.chat.ratelimit;

import java.time.Instant;

/**
 * Outcome of a limiter check.
 *
 * @param limit configured limit, or {@code -1} when the caller is not limited
 * @param degraded true when a tier could not answer and the fallback policy decided instead
 */
public record RateLimitDecision(
    boolean allowed,
    int limit,
    int remaining,
    Instant resetAt,
    RateLimitLayer layer,
    boolean degraded,
    String reason) {

  public static final int UNLIMITED = -1;

  public static RateLimitDecision fromCount(
      int count, int limit, Instant resetAt, RateLimitLayer layer) {
    boolean allowed = count <= limit;
    int remaining = Math.max(0, limit - count);
    return new RateLimitDecision(
        allowed, limit, remaining, resetAt, layer, false, allowed ? null : "daily limit");
  }

  /** Decision for the next message given the count so far, without counting it. */
  public static RateLimitDecision fromCurrent(
      int count, int limit, Instant resetAt, RateLimitLayer layer) {
    boolean allowed = count < limit;
    return new RateLimitDecision(
        allowed, limit, Math.max(0, limit - count), resetAt, layer, false, allowed ? null : "daily limit");
  }

  public static RateLimitDecision unlimited(Instant resetAt) {
    return new RateLimitDecision(true, UNLIMITED, UNLIMITED, resetAt, RateLimitLayer.NONE, false, null);
  }

  public static RateLimitDecision degradedAllow(int limit, Instant resetAt, RateLimitLayer layer) {
    return new RateLimitDecision(true, limit, limit, resetAt, layer, true, null);
  }

  public boolean isUnlimited() {
    return limit == UNLIMITED;
  }
}
