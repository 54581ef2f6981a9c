package com.qurse.backend.chat.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/** Process-local counter used as the fast tier when Redis is not configured. */
public final class InMemoryRateLimitCounter implements RateLimitCounter {

  private final Cache<String, AtomicInteger> counters;

  public InMemoryRateLimitCounter() {
    this(Duration.ofHours(25), 100_000);
  }

  InMemoryRateLimitCounter(Duration retention, long maximumSize) {
    this.counters =
        Caffeine.newBuilder().expireAfterWrite(retention).maximumSize(maximumSize).build();
  }

  @Override
  public int increment(String subjectKey, RateLimitWindow window) {
    return counters.get(key(subjectKey, window), ignored -> new AtomicInteger()).incrementAndGet();
  }

  @Override
  public int current(String subjectKey, RateLimitWindow window) {
    AtomicInteger counter = counters.getIfPresent(key(subjectKey, window));
    return counter != null ? counter.get() : 0;
  }

  @Override
  public RateLimitLayer layer() {
    return RateLimitLayer.MEMORY;
  }

  private String key(String subjectKey, RateLimitWindow window) {
    return subjectKey + ":" + window.bucket();
  }
}
