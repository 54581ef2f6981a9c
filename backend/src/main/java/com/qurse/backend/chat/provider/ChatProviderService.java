package com.qurse.backend.chat.provider;

import com.qurse.backend.chat.config.ChatProvidersProperties;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;

public class ChatProviderService {

  private final ChatProviderRegistry registry;
  private final Map<String, ChatProviderAdapter> adaptersById;

  public ChatProviderService(ChatProviderRegistry registry, List<ChatProviderAdapter> adapters) {
    this.registry = registry;
    this.adaptersById =
        adapters.stream()
            .collect(Collectors.toUnmodifiableMap(ChatProviderAdapter::providerId, Function.identity()));
  }

  public Optional<ChatProviderSelection> findSelection(String modelId) {
    return registry.findSelection(modelId);
  }

  public ChatProviderSelection resolveSelection(String provider, String model) {
    return registry.resolveSelection(provider, model);
  }

  public ChatProvidersProperties.Model model(ChatProviderSelection selection) {
    return registry.requireModel(selection);
  }

  public boolean supportsStreaming(ChatProviderSelection selection) {
    return registry.supportsStreaming(selection);
  }

  public ChatClient chatClient(String providerId) {
    return adapter(providerId).chatClient();
  }

  public ChatOptions buildOptions(ChatProviderSelection selection) {
    return adapter(selection.providerId()).buildOptions(selection);
  }

  public ChatOptions buildStreamingOptions(ChatProviderSelection selection) {
    return adapter(selection.providerId()).buildStreamingOptions(selection);
  }

  private ChatProviderAdapter adapter(String providerId) {
    ChatProviderAdapter adapter = adaptersById.get(providerId);
    if (adapter == null) {
      throw new IllegalArgumentException(
          "No chat client adapter registered for provider '" + providerId + "'");
    }
    return adapter;
  }
}
