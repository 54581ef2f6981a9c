package com.qurse.backend.chat.context;

import com.qurse.backend.chat.api.ChatMessagePayload;
import java.util.List;

public record ContextTrimResult(
    List<ChatMessagePayload> messages,
    int originalTokens,
    int trimmedTokens,
    int removedReasoningFrom,
    int droppedMessages) {

  public boolean trimmed() {
    return removedReasoningFrom > 0 || droppedMessages > 0;
  }
}
