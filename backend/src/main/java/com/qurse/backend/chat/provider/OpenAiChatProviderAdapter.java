package com.qurse.backend.chat.provider;

import com.qurse.backend.chat.config.ChatProviderType;
import com.qurse.backend.chat.config.ChatProvidersProperties;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.advisor.SimpleLoggerAdvisor;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

public class OpenAiChatProviderAdapter implements ChatProviderAdapter {

  private final String providerId;
  private final ChatProvidersProperties.Provider providerConfig;
  private final ChatClient chatClient;

  public OpenAiChatProviderAdapter(
      String providerId, ChatProvidersProperties.Provider providerConfig, OpenAiApi openAiApi) {
    this(providerId, providerConfig, buildModel(providerConfig, openAiApi));
  }

  OpenAiChatProviderAdapter(
      String providerId, ChatProvidersProperties.Provider providerConfig, ChatModel chatModel) {
    Assert.notNull(providerConfig, "providerConfig must not be null");
    Assert.state(
        providerConfig.getType() == ChatProviderType.OPENAI,
        () -> "Invalid provider type for OpenAI adapter: " + providerConfig.getType());
    this.providerId = providerId;
    this.providerConfig = providerConfig;
    this.chatClient = ChatClient.builder(chatModel).defaultAdvisors(new SimpleLoggerAdvisor()).build();
  }

  private static ChatModel buildModel(
      ChatProvidersProperties.Provider providerConfig, OpenAiApi openAiApi) {
    OpenAiChatOptions.Builder defaults = OpenAiChatOptions.builder();
    if (StringUtils.hasText(providerConfig.getDefaultModel())) {
      defaults.model(resolveProviderModel(providerConfig, providerConfig.getDefaultModel()));
    }
    return OpenAiChatModel.builder().openAiApi(openAiApi).defaultOptions(defaults.build()).build();
  }

  @Override
  public String providerId() {
    return providerId;
  }

  @Override
  public ChatClient chatClient() {
    return chatClient;
  }

  @Override
  public ChatOptions buildOptions(ChatProviderSelection selection) {
    return configureBuilder(selection).build();
  }

  @Override
  public ChatOptions buildStreamingOptions(ChatProviderSelection selection) {
    OpenAiChatOptions.Builder builder = configureBuilder(selection);
    builder.streamUsage(true);
    return builder.build();
  }

  private OpenAiChatOptions.Builder configureBuilder(ChatProviderSelection selection) {
    OpenAiChatOptions.Builder builder = OpenAiChatOptions.builder();
    builder.model(resolveProviderModel(providerConfig, selection.modelId()));
    ChatProvidersProperties.Model modelConfig = providerConfig.getModels().get(selection.modelId());
    boolean useCompletionTokens = modelConfig != null && modelConfig.isUseCompletionTokens();

    if (providerConfig.getTemperature() != null) {
      builder.temperature(providerConfig.getTemperature());
    }
    if (providerConfig.getTopP() != null) {
      builder.topP(providerConfig.getTopP());
    }
    Integer maxTokens = providerConfig.getMaxTokens();
    if (maxTokens != null) {
      if (useCompletionTokens) {
        builder.maxCompletionTokens(maxTokens);
      } else {
        builder.maxTokens(maxTokens);
      }
    }
    return builder;
  }

  private static String resolveProviderModel(
      ChatProvidersProperties.Provider providerConfig, String modelId) {
    ChatProvidersProperties.Model model = providerConfig.getModels().get(modelId);
    if (model != null && StringUtils.hasText(model.getProviderModel())) {
      return model.getProviderModel();
    }
    return modelId;
  }
}
