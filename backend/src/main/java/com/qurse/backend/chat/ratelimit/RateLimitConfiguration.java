package com.qurse.backend.chat.ratelimit;

import com.qurse.backend.chat.config.RateLimitProperties;
import com.qurse.backend.chat.metrics.ChatMetrics;
import java.time.Clock;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;

@Configuration
@EnableConfigurationProperties(RateLimitProperties.class)
@Slf4j
public class RateLimitConfiguration {

  private static final AtomicInteger WORKER_SEQUENCE = new AtomicInteger();

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean(name = "rateLimitExecutor", destroyMethod = "shutdown")
  public ThreadPoolExecutor rateLimitExecutor(RateLimitProperties properties) {
    return buildExecutor(properties.getExecutorPoolSize(), properties.getExecutorQueueCapacity());
  }

  static ThreadPoolExecutor buildExecutor(int poolSize, int queueCapacity) {
    int threads = Math.max(1, poolSize);
    BlockingQueue<Runnable> queue = new ArrayBlockingQueue<>(Math.max(1, queueCapacity));
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("rate-limit-" + WORKER_SEQUENCE.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };
    return new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS, queue, factory);
  }

  @Bean
  public JdbcRateLimitCounter durableRateLimitCounter(
      JdbcTemplate jdbcTemplate, RateLimitProperties properties) {
    return new JdbcRateLimitCounter(jdbcTemplate, properties.getTimeout());
  }

  @Bean
  public RateLimiter rateLimiter(
      RateLimitProperties properties,
      ObjectProvider<StringRedisTemplate> redisTemplateProvider,
      JdbcRateLimitCounter durableRateLimitCounter,
      @Qualifier("rateLimitExecutor") ThreadPoolExecutor rateLimitExecutor,
      ChatMetrics chatMetrics,
      Clock clock) {
    RateLimitCounter fastCounter = fastCounter(properties, redisTemplateProvider);
    log.info("Rate limiter fast tier: {}", fastCounter.layer().wireName());
    return new TieredRateLimiter(
        fastCounter,
        durableRateLimitCounter,
        properties,
        rateLimitExecutor,
        chatMetrics,
        clock);
  }

  private RateLimitCounter fastCounter(
      RateLimitProperties properties, ObjectProvider<StringRedisTemplate> redisTemplateProvider) {
    if (!properties.isRedisEnabled()) {
      return new InMemoryRateLimitCounter();
    }
    StringRedisTemplate redisTemplate = redisTemplateProvider.getIfAvailable();
    if (redisTemplate == null) {
      return new InMemoryRateLimitCounter();
    }
    return new RedisRateLimitCounter(redisTemplate, properties.getRedisKeyPrefix());
  }
}
