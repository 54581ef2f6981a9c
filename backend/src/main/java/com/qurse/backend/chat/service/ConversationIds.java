package com.qurse.backend.chat.service;

import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import org.springframework.util.StringUtils;

/** Conversation id formats accepted from clients. */
public final class ConversationIds {

  public static final String PLACEHOLDER_PREFIX = "temp-";

  private static final Pattern UUID_PATTERN =
      Pattern.compile(
          "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

  private ConversationIds() {}

  public static boolean isPlaceholder(String conversationId) {
    return conversationId != null && conversationId.startsWith(PLACEHOLDER_PREFIX);
  }

  /** A canonical UUID, or {@code temp-} followed by one. */
  public static boolean isWellFormed(String conversationId) {
    if (!StringUtils.hasText(conversationId)) {
      return false;
    }
    String candidate =
        isPlaceholder(conversationId)
            ? conversationId.substring(PLACEHOLDER_PREFIX.length())
            : conversationId;
    return UUID_PATTERN.matcher(candidate).matches();
  }

  /** The durable id carried by {@code conversationId}; empty for blank or placeholder ids. */
  public static Optional<UUID> durable(String conversationId) {
    if (!StringUtils.hasText(conversationId) || isPlaceholder(conversationId)) {
      return Optional.empty();
    }
    String trimmed = conversationId.trim();
    if (!UUID_PATTERN.matcher(trimmed).matches()) {
      return Optional.empty();
    }
    return Optional.of(UUID.fromString(trimmed));
  }
}
