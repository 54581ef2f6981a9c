package com.qurse.backend.chat.ratelimit;

public enum RateLimitLayer {
  REDIS("redis"),
  MEMORY("memory"),
  DATABASE("database"),
  NONE("none");

  private final String wireName;

  RateLimitLayer(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }
}
