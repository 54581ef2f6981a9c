package com.qurse.backend.chat.provider;

import com.qurse.backend.chat.config.ChatProvidersProperties;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.springframework.util.StringUtils;

public class ChatProviderRegistry {

  private final ChatProvidersProperties properties;

  public ChatProviderRegistry(ChatProvidersProperties properties) {
    this.properties = properties;
  }

  public ChatProvidersProperties.Provider requireProvider(String providerId) {
    if (!StringUtils.hasText(providerId)) {
      throw new IllegalArgumentException("Provider identifier must be defined");
    }
    ChatProvidersProperties.Provider provider = properties.getProviders().get(providerId);
    if (provider == null) {
      throw new IllegalArgumentException("Unknown provider: " + providerId);
    }
    return provider;
  }

  public ChatProvidersProperties.Model requireModel(ChatProviderSelection selection) {
    ChatProvidersProperties.Model model =
        requireProvider(selection.providerId()).getModels().get(selection.modelId());
    if (model == null) {
      throw new IllegalArgumentException(
          "Model '"
              + selection.modelId()
              + "' is not configured for provider '"
              + selection.providerId()
              + "'");
    }
    return model;
  }

  /**
   * Finds the provider serving {@code modelId}, consulting the default provider first. A blank
   * id resolves to the configured default model.
   */
  public Optional<ChatProviderSelection> findSelection(String modelId) {
    String resolvedModelId =
        StringUtils.hasText(modelId) ? modelId.trim() : properties.getDefaultModel();
    for (Map.Entry<String, ChatProvidersProperties.Provider> entry : orderedProviders().entrySet()) {
      if (entry.getValue().getModels().containsKey(resolvedModelId)) {
        return Optional.of(new ChatProviderSelection(entry.getKey(), resolvedModelId));
      }
    }
    return Optional.empty();
  }

  public ChatProviderSelection resolveSelection(String requestedProvider, String requestedModel) {
    String providerId =
        Optional.ofNullable(requestedProvider)
            .filter(StringUtils::hasText)
            .orElse(properties.getDefaultProvider());
    ChatProvidersProperties.Provider provider = requireProvider(providerId);
    String modelId =
        Optional.ofNullable(requestedModel)
            .filter(StringUtils::hasText)
            .orElse(provider.getDefaultModel());
    if (!provider.getModels().containsKey(modelId)) {
      throw new IllegalArgumentException(
          "Model '" + modelId + "' is not available for provider '" + providerId + "'");
    }
    return new ChatProviderSelection(providerId, modelId);
  }

  public boolean supportsStreaming(ChatProviderSelection selection) {
    return requireModel(selection).isStreamingEnabled();
  }

  private Map<String, ChatProvidersProperties.Provider> orderedProviders() {
    Map<String, ChatProvidersProperties.Provider> ordered = new LinkedHashMap<>();
    String defaultProvider = properties.getDefaultProvider();
    if (StringUtils.hasText(defaultProvider) && properties.getProviders().containsKey(defaultProvider)) {
      ordered.put(defaultProvider, properties.getProviders().get(defaultProvider));
    }
    properties.getProviders().forEach(ordered::putIfAbsent);
    return ordered;
  }
}
