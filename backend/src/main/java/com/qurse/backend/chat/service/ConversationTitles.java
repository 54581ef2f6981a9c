package com.qurse.backend.chat.service;

import org.springframework.util.StringUtils;

public final class ConversationTitles {

  public static final String DEFAULT_TITLE = "New Chat";

  private ConversationTitles() {}

  /** First {@code length} characters of the message, with an ellipsis when truncated. */
  public static String fallback(String firstUserText, int length) {
    if (!StringUtils.hasText(firstUserText)) {
      return DEFAULT_TITLE;
    }
    String trimmed = firstUserText.trim();
    if (trimmed.length() <= length) {
      return trimmed;
    }
    return trimmed.substring(0, length) + "...";
  }
}
