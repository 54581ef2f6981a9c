package com.qurse.backend.chat.ratelimit;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/** Daily counting window, aligned to midnight UTC. */
public record RateLimitWindow(LocalDate day, Instant start, Instant resetAt) {

  public static RateLimitWindow today(Clock clock) {
    LocalDate day = LocalDate.now(clock.withZone(ZoneOffset.UTC));
    Instant start = day.atStartOfDay(ZoneOffset.UTC).toInstant();
    Instant resetAt = day.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
    return new RateLimitWindow(day, start, resetAt);
  }

  /** Key suffix identifying this window, e.g. {@code 2025-01-31}. */
  public String bucket() {
    return day.toString();
  }
}
