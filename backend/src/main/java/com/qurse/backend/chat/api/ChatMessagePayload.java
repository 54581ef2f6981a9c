package com.qurse.backend.chat.api;

import com.qurse.backend.chat.domain.ChatRole;
import com.qurse.backend.chat.domain.MessagePart;
import com.qurse.backend.chat.domain.MessageParts;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import org.springframework.util.StringUtils;

public record ChatMessagePayload(
    @Schema(description = "Client-side message id", example = "msg_01") String id,
    @Schema(description = "Author of the message", example = "user") @NotNull ChatRole role,
    @Schema(description = "Typed content parts") List<MessagePart> parts,
    @Schema(description = "Plain text content, used when parts are absent") String content) {

  /** Parts as sent, or a single text part built from {@code content}. */
  public List<MessagePart> effectiveParts() {
    if (parts != null && !parts.isEmpty()) {
      return parts;
    }
    if (StringUtils.hasText(content)) {
      return MessageParts.ofText(content);
    }
    return List.of();
  }

  public static ChatMessagePayload user(String text) {
    return new ChatMessagePayload(null, ChatRole.USER, MessageParts.ofText(text), null);
  }
}
