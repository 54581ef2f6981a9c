package com.qurse.backend.chat.dedup;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.qurse.backend.chat.config.DuplicateDetectionProperties;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

@ExtendWith(MockitoExtension.class)
class DuplicateSweepJobTest {

  @Mock private DuplicateSweepService sweepService;
  @Mock private TaskScheduler taskScheduler;

  @Test
  void schedulesSweepWithConfiguredDelay() {
    DuplicateDetectionProperties properties = new DuplicateDetectionProperties();
    properties.setSweepInterval(Duration.ofMinutes(10));

    new DuplicateSweepJob(sweepService, properties, taskScheduler).scheduleSweep();

    verify(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), eq(Duration.ofMinutes(10)));
  }

  @Test
  void zeroIntervalDisablesScheduling() {
    DuplicateDetectionProperties properties = new DuplicateDetectionProperties();
    properties.setSweepInterval(Duration.ZERO);

    new DuplicateSweepJob(sweepService, properties, taskScheduler).scheduleSweep();

    verifyNoInteractions(taskScheduler);
  }

  @Test
  void failedSweepDoesNotEscapeTheScheduler() {
    when(sweepService.sweep()).thenThrow(new IllegalStateException("database unavailable"));

    new DuplicateSweepJob(sweepService, new DuplicateDetectionProperties(), taskScheduler)
        .safeSweep();

    verify(sweepService).sweep();
  }
}
