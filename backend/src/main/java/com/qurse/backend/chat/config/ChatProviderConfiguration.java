package com.qurse.backend.chat.config;

import com.qurse.backend.chat.provider.ChatProviderAdapter;
import com.qurse.backend.chat.provider.ChatProviderRegistry;
import com.qurse.backend.chat.provider.ChatProviderService;
import com.qurse.backend.chat.provider.OpenAiChatProviderAdapter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties({ChatProvidersProperties.class, ChatModesProperties.class})
public class ChatProviderConfiguration {

  @Bean
  public ChatProviderRegistry chatProviderRegistry(ChatProvidersProperties properties) {
    return new ChatProviderRegistry(properties);
  }

  @Bean
  public List<ChatProviderAdapter> chatProviderAdapters(ChatProvidersProperties properties) {
    Map<String, ChatProvidersProperties.Provider> providers = properties.getProviders();
    List<ChatProviderAdapter> adapters = new ArrayList<>(providers.size());

    providers.forEach(
        (providerId, providerConfig) -> {
          if (providerConfig.getType() == ChatProviderType.OPENAI) {
            adapters.add(
                new OpenAiChatProviderAdapter(providerId, providerConfig, openAiApi(providerConfig)));
          } else {
            throw new IllegalStateException(
                "Unsupported provider type for '" + providerId + "': " + providerConfig.getType());
          }
        });

    Assert.state(!adapters.isEmpty(), "At least one chat provider must be defined");
    return adapters;
  }

  @Bean
  public ChatProviderService chatProviderService(
      ChatProviderRegistry registry, List<ChatProviderAdapter> adapters) {
    return new ChatProviderService(registry, adapters);
  }

  private OpenAiApi openAiApi(ChatProvidersProperties.Provider providerConfig) {
    OpenAiApi.Builder builder = OpenAiApi.builder();
    if (StringUtils.hasText(providerConfig.getBaseUrl())) {
      builder.baseUrl(providerConfig.getBaseUrl());
    }
    builder.apiKey(StringUtils.hasText(providerConfig.getApiKey()) ? providerConfig.getApiKey() : "unset");
    if (StringUtils.hasText(providerConfig.getCompletionsPath())) {
      builder.completionsPath(providerConfig.getCompletionsPath());
    }
    if (providerConfig.getTimeout() != null) {
      SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
      requestFactory.setConnectTimeout(providerConfig.getTimeout());
      requestFactory.setReadTimeout(providerConfig.getTimeout());
      builder.restClientBuilder(RestClient.builder().requestFactory(requestFactory));
    }
    return builder.build();
  }
}
