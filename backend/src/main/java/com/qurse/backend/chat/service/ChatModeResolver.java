package com.qurse.backend.chat.service;

import com.qurse.backend.chat.config.ChatModesProperties;
import com.qurse.backend.common.exception.ChatModeException;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class ChatModeResolver {

  private final ChatModesProperties properties;

  public ChatModeResolver(ChatModesProperties properties) {
    this.properties = properties;
  }

  /** Blank resolves to the default mode; unknown ids are rejected. */
  public ChatModeSelection resolve(String chatMode) {
    String modeId =
        StringUtils.hasText(chatMode)
            ? chatMode.trim().toLowerCase(Locale.ROOT)
            : properties.getDefaultMode();
    ChatModesProperties.Mode mode = properties.getRegistry().get(modeId);
    if (mode == null) {
      throw new ChatModeException(chatMode);
    }
    List<String> tools = mode.getEnabledTools() != null ? List.copyOf(mode.getEnabledTools()) : List.of();
    return new ChatModeSelection(modeId, mode.getSystemPrompt(), tools);
  }
}
