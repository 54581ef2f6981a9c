package com.qurse.backend.chat.context;

import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import com.knuddels.jtokkit.api.ModelType;
import com.qurse.backend.chat.api.ChatMessagePayload;
import com.qurse.backend.chat.domain.MessagePart;
import com.qurse.backend.chat.domain.ReasoningPart;
import com.qurse.backend.chat.domain.TextPart;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

public class TokenCounter {

  private static final Logger log = LoggerFactory.getLogger(TokenCounter.class);

  /** Role and separator tokens every chat message costs on top of its content. */
  static final int MESSAGE_OVERHEAD = 4;

  private final EncodingRegistry encodingRegistry;
  private final String defaultTokenizer;
  private final Map<String, Encoding> encodings = new ConcurrentHashMap<>();

  public TokenCounter(EncodingRegistry encodingRegistry, String defaultTokenizer) {
    this.encodingRegistry = encodingRegistry;
    this.defaultTokenizer = StringUtils.hasText(defaultTokenizer) ? defaultTokenizer : "cl100k_base";
  }

  public int count(String text, String tokenizer) {
    if (!StringUtils.hasText(text)) {
      return 0;
    }
    String tokenizerName = StringUtils.hasText(tokenizer) ? tokenizer.trim() : defaultTokenizer;
    Encoding encoding = encodings.computeIfAbsent(tokenizerName, this::resolveEncoding);
    try {
      return encoding.countTokensOrdinary(text);
    } catch (RuntimeException ordinaryFailure) {
      log.debug("Falling back to strict token counting due to {}", ordinaryFailure.getMessage());
      return encoding.countTokens(text);
    }
  }

  public int countMessage(ChatMessagePayload message, String tokenizer) {
    int tokens = MESSAGE_OVERHEAD;
    for (MessagePart part : message.effectiveParts()) {
      tokens += count(partText(part), tokenizer);
    }
    return tokens;
  }

  public int countMessages(List<ChatMessagePayload> messages, String tokenizer) {
    int tokens = 0;
    for (ChatMessagePayload message : messages) {
      tokens += countMessage(message, tokenizer);
    }
    return tokens;
  }

  private String partText(MessagePart part) {
    return switch (part.kind()) {
      case TEXT -> ((TextPart) part).text();
      case REASONING -> ((ReasoningPart) part).text();
      case TOOL_INVOCATION, FILE -> null;
    };
  }

  private Encoding resolveEncoding(String tokenizerName) {
    return encodingRegistry
        .getEncodingForModel(tokenizerName)
        .orElseGet(
            () ->
                ModelType.fromName(tokenizerName)
                    .map(encodingRegistry::getEncodingForModel)
                    .orElseGet(() -> resolveEncodingByTypeOrName(tokenizerName)));
  }

  private Encoding resolveEncodingByTypeOrName(String tokenizerName) {
    return EncodingType.fromName(tokenizerName)
        .map(encodingRegistry::getEncoding)
        .orElseGet(
            () ->
                encodingRegistry
                    .getEncoding(tokenizerName)
                    .orElseGet(
                        () -> {
                          log.warn(
                              "Unknown tokenizer '{}', counting with {}", tokenizerName, defaultTokenizer);
                          return encodingRegistry.getEncoding(EncodingType.CL100K_BASE);
                        }));
  }
}
