package com.qurse.backend.chat.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.chat.dedup")
public class DuplicateDetectionProperties {

  /**
   * Two assistant messages are only compared when created at most this far apart.
   */
  private Duration window = Duration.ofSeconds(10);

  /**
   * How far back the offline sweep scans.
   */
  private Duration sweepLookback = Duration.ofDays(7);

  /**
   * Delay between sweep runs. Zero or negative disables the scheduler.
   */
  private Duration sweepInterval = Duration.ofHours(24);

  public Duration getWindow() {
    return window;
  }

  public void setWindow(Duration window) {
    this.window = window;
  }

  public Duration getSweepLookback() {
    return sweepLookback;
  }

  public void setSweepLookback(Duration sweepLookback) {
    this.sweepLookback = sweepLookback;
  }

  public Duration getSweepInterval() {
    return sweepInterval;
  }

  public void setSweepInterval(Duration sweepInterval) {
    this.sweepInterval = sweepInterval;
  }
}
