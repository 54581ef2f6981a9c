package com.qurse.backend.chat.service;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Best-effort work detached from the request. Tasks are never awaited or retried; a failure ends
 * at the log.
 */
@Component
@Slf4j
public class BackgroundTasks {

  private final ExecutorService executor;

  public BackgroundTasks(@Qualifier("chatBackgroundExecutor") ExecutorService executor) {
    this.executor = executor;
  }

  public void submit(String description, Runnable task) {
    try {
      executor.execute(() -> runSafely(description, task));
    } catch (RejectedExecutionException rejected) {
      log.warn("Background task '{}' rejected, queue is full", description);
    }
  }

  private void runSafely(String description, Runnable task) {
    try {
      task.run();
    } catch (RuntimeException ex) {
      log.warn("Background task '{}' failed", description, ex);
    }
  }
}
