package com.qurse.backend.chat.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.chat.title")
public class TitleProperties {

  private boolean enabled = true;

  /** First user messages longer than this get a generated title. */
  private int minLength = 50;

  private int maxLength = 60;

  /** Length of the truncated fallback title. */
  private int fallbackLength = 50;

  private String provider;
  private String model;

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public int getMinLength() {
    return minLength;
  }

  public void setMinLength(int minLength) {
    this.minLength = minLength;
  }

  public int getMaxLength() {
    return maxLength;
  }

  public void setMaxLength(int maxLength) {
    this.maxLength = maxLength;
  }

  public int getFallbackLength() {
    return fallbackLength;
  }

  public void setFallbackLength(int fallbackLength) {
    this.fallbackLength = fallbackLength;
  }

  public String getProvider() {
    return provider;
  }

  public void setProvider(String provider) {
    this.provider = provider;
  }

  public String getModel() {
    return model;
  }

  public void setModel(String model) {
    this.model = model;
  }
}
