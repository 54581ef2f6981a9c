package com.qurse.backend.chat.ratelimit;

/** Atomic counter keyed by subject and daily window. */
public interface RateLimitCounter {

  /** Increments the counter and returns the value after the increment. */
  int increment(String subjectKey, RateLimitWindow window);

  /** Returns the current value without changing it. */
  int current(String subjectKey, RateLimitWindow window);

  RateLimitLayer layer();
}
