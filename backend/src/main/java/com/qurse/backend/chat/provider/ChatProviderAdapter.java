package com.qurse.backend.chat.provider;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;

public interface ChatProviderAdapter {

  String providerId();

  ChatClient chatClient();

  ChatOptions buildOptions(ChatProviderSelection selection);

  default ChatOptions buildStreamingOptions(ChatProviderSelection selection) {
    return buildOptions(selection);
  }
}
