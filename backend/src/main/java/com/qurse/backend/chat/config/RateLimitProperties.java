package com.qurse.backend.chat.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.chat.rate-limit")
public class RateLimitProperties {

  /** Daily messages for anonymous sessions, counted in the durable store. */
  private int guestDailyLimit = 10;

  /** Daily messages per client IP for anonymous callers, counted in the fast tier. */
  private int ipDailyLimit = 10;

  /** Daily messages for authenticated users without a subscription. */
  private int freeDailyLimit = 20;

  /** Upper bound for a single limiter tier; slower answers are treated as an outage. */
  private Duration timeout = Duration.ofMillis(500);

  /** Use Redis for the fast tier when a connection is available. */
  private boolean redisEnabled = true;

  private String redisKeyPrefix = "ratelimit";

  /** Worker threads that run counter calls; a stalled store can hold at most this many. */
  private int executorPoolSize = 8;

  /** Counter calls waiting for a worker; beyond this a call is answered as degraded. */
  private int executorQueueCapacity = 64;

  public int getGuestDailyLimit() {
    return guestDailyLimit;
  }

  public void setGuestDailyLimit(int guestDailyLimit) {
    this.guestDailyLimit = guestDailyLimit;
  }

  public int getIpDailyLimit() {
    return ipDailyLimit;
  }

  public void setIpDailyLimit(int ipDailyLimit) {
    this.ipDailyLimit = ipDailyLimit;
  }

  public int getFreeDailyLimit() {
    return freeDailyLimit;
  }

  public void setFreeDailyLimit(int freeDailyLimit) {
    this.freeDailyLimit = freeDailyLimit;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }

  public boolean isRedisEnabled() {
    return redisEnabled;
  }

  public void setRedisEnabled(boolean redisEnabled) {
    this.redisEnabled = redisEnabled;
  }

  public String getRedisKeyPrefix() {
    return redisKeyPrefix;
  }

  public void setRedisKeyPrefix(String redisKeyPrefix) {
    this.redisKeyPrefix = redisKeyPrefix;
  }

  public int getExecutorPoolSize() {
    return executorPoolSize;
  }

  public void setExecutorPoolSize(int executorPoolSize) {
    this.executorPoolSize = executorPoolSize;
  }

  public int getExecutorQueueCapacity() {
    return executorQueueCapacity;
  }

  public void setExecutorQueueCapacity(int executorQueueCapacity) {
    this.executorQueueCapacity = executorQueueCapacity;
  }
}
