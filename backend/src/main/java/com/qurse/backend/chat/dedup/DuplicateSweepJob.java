package com.qurse.backend.chat.dedup;

import com.qurse.backend.chat.config.DuplicateDetectionProperties;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class DuplicateSweepJob {

  private final DuplicateSweepService sweepService;
  private final DuplicateDetectionProperties properties;
  private final TaskScheduler taskScheduler;

  public DuplicateSweepJob(
      DuplicateSweepService sweepService,
      DuplicateDetectionProperties properties,
      TaskScheduler taskScheduler) {
    this.sweepService = sweepService;
    this.properties = properties;
    this.taskScheduler = taskScheduler;
  }

  @PostConstruct
  void scheduleSweep() {
    Duration interval = properties.getSweepInterval();
    if (interval == null || interval.isZero() || interval.isNegative()) {
      log.info("Duplicate sweep scheduler disabled (interval={})", interval);
      return;
    }
    taskScheduler.scheduleWithFixedDelay(this::safeSweep, interval);
    log.info("Duplicate sweep scheduler started with interval {}", interval);
  }

  void safeSweep() {
    try {
      sweepService.sweep();
    } catch (Exception exception) {
      log.warn("Duplicate sweep task failed", exception);
    }
  }
}
