package com.qurse.backend.chat.context;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.qurse.backend.chat.config.ContextWindowProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ChatContextConfiguration {

  @Bean
  public EncodingRegistry encodingRegistry() {
    return Encodings.newDefaultEncodingRegistry();
  }

  @Bean
  public TokenCounter tokenCounter(
      EncodingRegistry encodingRegistry, ContextWindowProperties properties) {
    return new TokenCounter(encodingRegistry, properties.getDefaultTokenizer());
  }

  @Bean
  public ContextTrimmer contextTrimmer(
      TokenCounter tokenCounter, ContextWindowProperties properties) {
    return new ContextTrimmer(tokenCounter, properties);
  }
}
