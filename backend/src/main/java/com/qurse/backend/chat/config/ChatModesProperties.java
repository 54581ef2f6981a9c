package com.qurse.backend.chat.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.chat.modes")
public class ChatModesProperties {

  private String defaultMode = "chat";
  private Map<String, Mode> registry = new LinkedHashMap<>();

  public String getDefaultMode() {
    return defaultMode;
  }

  public void setDefaultMode(String defaultMode) {
    this.defaultMode = defaultMode;
  }

  public Map<String, Mode> getRegistry() {
    return registry;
  }

  public void setRegistry(Map<String, Mode> registry) {
    this.registry = registry;
  }

  public static class Mode {
    private String name;
    private String systemPrompt;
    private List<String> enabledTools = new ArrayList<>();

    public String getName() {
      return name;
    }

    public void setName(String name) {
      this.name = name;
    }

    public String getSystemPrompt() {
      return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
      this.systemPrompt = systemPrompt;
    }

    public List<String> getEnabledTools() {
      return enabledTools;
    }

    public void setEnabledTools(List<String> enabledTools) {
      this.enabledTools = enabledTools;
    }
  }
}
