package com.qurse.backend.chat.config;

import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "app.chat")
@Validated
public class ChatProvidersProperties {

  /**
   * Identifier of the provider consulted first when a model id is resolved.
   */
  @NotBlank private String defaultProvider;

  /**
   * Model used when the request does not name one.
   */
  @NotBlank private String defaultModel = "openai/gpt-oss-120b";

  private Map<String, Provider> providers = new LinkedHashMap<>();

  public String getDefaultProvider() {
    return defaultProvider;
  }

  public void setDefaultProvider(String defaultProvider) {
    this.defaultProvider = defaultProvider;
  }

  public String getDefaultModel() {
    return defaultModel;
  }

  public void setDefaultModel(String defaultModel) {
    this.defaultModel = defaultModel;
  }

  public Map<String, Provider> getProviders() {
    return providers;
  }

  public void setProviders(Map<String, Provider> providers) {
    this.providers = providers;
  }

  public static class Provider {

    private ChatProviderType type = ChatProviderType.OPENAI;
    private String displayName;
    private String baseUrl;
    private String apiKey;
    private String completionsPath;
    private Duration timeout = Duration.ofSeconds(60);
    private Integer maxTokens;
    private Double temperature;
    private Double topP;
    private String defaultModel;
    private Map<String, Model> models = new LinkedHashMap<>();

    public ChatProviderType getType() {
      return type;
    }

    public void setType(ChatProviderType type) {
      this.type = type;
    }

    public String getDisplayName() {
      return displayName;
    }

    public void setDisplayName(String displayName) {
      this.displayName = displayName;
    }

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public String getApiKey() {
      return apiKey;
    }

    public void setApiKey(String apiKey) {
      this.apiKey = apiKey;
    }

    public String getCompletionsPath() {
      return completionsPath;
    }

    public void setCompletionsPath(String completionsPath) {
      this.completionsPath = completionsPath;
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }

    public Integer getMaxTokens() {
      return maxTokens;
    }

    public void setMaxTokens(Integer maxTokens) {
      this.maxTokens = maxTokens;
    }

    public Double getTemperature() {
      return temperature;
    }

    public void setTemperature(Double temperature) {
      this.temperature = temperature;
    }

    public Double getTopP() {
      return topP;
    }

    public void setTopP(Double topP) {
      this.topP = topP;
    }

    public String getDefaultModel() {
      return defaultModel;
    }

    public void setDefaultModel(String defaultModel) {
      this.defaultModel = defaultModel;
    }

    public Map<String, Model> getModels() {
      return models;
    }

    public void setModels(Map<String, Model> models) {
      this.models = models;
    }
  }

  public static class Model {
    private String displayName;

    /** Provider-side model name; defaults to the catalog key. */
    private String providerModel;

    /** Guests may not use the model. */
    private boolean requiresAuth;

    /** Only entitled (paid) users may use the model. */
    private boolean requiresPro;

    private boolean streamingEnabled = true;
    private boolean useCompletionTokens;
    private int contextWindow = 128_000;
    private String tokenizer;

    public String getDisplayName() {
      return displayName;
    }

    public void setDisplayName(String displayName) {
      this.displayName = displayName;
    }

    public String getProviderModel() {
      return providerModel;
    }

    public void setProviderModel(String providerModel) {
      this.providerModel = providerModel;
    }

    public boolean isRequiresAuth() {
      return requiresAuth;
    }

    public void setRequiresAuth(boolean requiresAuth) {
      this.requiresAuth = requiresAuth;
    }

    public boolean isRequiresPro() {
      return requiresPro;
    }

    public void setRequiresPro(boolean requiresPro) {
      this.requiresPro = requiresPro;
    }

    public boolean isStreamingEnabled() {
      return streamingEnabled;
    }

    public void setStreamingEnabled(boolean streamingEnabled) {
      this.streamingEnabled = streamingEnabled;
    }

    public boolean isUseCompletionTokens() {
      return useCompletionTokens;
    }

    public void setUseCompletionTokens(boolean useCompletionTokens) {
      this.useCompletionTokens = useCompletionTokens;
    }

    public int getContextWindow() {
      return contextWindow;
    }

    public void setContextWindow(int contextWindow) {
      this.contextWindow = contextWindow;
    }

    public String getTokenizer() {
      return tokenizer;
    }

    public void setTokenizer(String tokenizer) {
      this.tokenizer = tokenizer;
    }
  }
}
