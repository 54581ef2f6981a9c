package com.qurse.backend.chat.ratelimit;

import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.util.StringUtils;

/** Fixed-window counter on Redis INCR; the key expires when the window resets. */
public final class RedisRateLimitCounter implements RateLimitCounter {

  private final StringRedisTemplate redisTemplate;
  private final ValueOperations<String, String> valueOperations;
  private final String keyPrefix;

  public RedisRateLimitCounter(StringRedisTemplate redisTemplate, String keyPrefix) {
    this.redisTemplate = redisTemplate;
    this.valueOperations = redisTemplate.opsForValue();
    this.keyPrefix = StringUtils.hasText(keyPrefix) ? keyPrefix : "ratelimit";
  }

  @Override
  public int increment(String subjectKey, RateLimitWindow window) {
    String key = key(subjectKey, window);
    Long count = valueOperations.increment(key);
    if (count == null) {
      throw new IllegalStateException("Redis returned no value for INCR " + key);
    }
    if (count == 1L) {
      redisTemplate.expireAt(key, window.resetAt());
    }
    return Math.toIntExact(count);
  }

  @Override
  public int current(String subjectKey, RateLimitWindow window) {
    String value = valueOperations.get(key(subjectKey, window));
    return StringUtils.hasText(value) ? Integer.parseInt(value) : 0;
  }

  @Override
  public RateLimitLayer layer() {
    return RateLimitLayer.REDIS;
  }

  private String key(String subjectKey, RateLimitWindow window) {
    return keyPrefix + ":" + subjectKey + ":" + window.bucket();
  }
}
