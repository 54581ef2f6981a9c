package com.qurse.backend.chat.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
  BackgroundTaskProperties.class,
  DuplicateDetectionProperties.class,
  TitleProperties.class,
  ContextWindowProperties.class
})
public class ChatBackgroundConfiguration {

  /** Detached work queue for assistant saves and title enrichment. */
  @Bean(name = "chatBackgroundExecutor", destroyMethod = "shutdown")
  public ExecutorService chatBackgroundExecutor(BackgroundTaskProperties properties) {
    int poolSize = Math.max(1, properties.getPoolSize());
    ThreadFactory threadFactory =
        new ThreadFactory() {
          private final AtomicInteger index = new AtomicInteger();

          @Override
          public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName("chat-background-" + index.incrementAndGet());
            return thread;
          }
        };
    return new ThreadPoolExecutor(
        poolSize,
        poolSize,
        60L,
        TimeUnit.SECONDS,
        new LinkedBlockingQueue<>(Math.max(1, properties.getQueueCapacity())),
        threadFactory);
  }
}
