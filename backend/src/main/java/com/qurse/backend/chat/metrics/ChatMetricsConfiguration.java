package com.qurse.backend.chat.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ChatMetricsConfiguration {

  @Bean
  public ChatMetrics chatMetrics(MeterRegistry meterRegistry) {
    return new ChatMetrics(meterRegistry);
  }
}
