package com.qurse.backend.chat.api;

import java.util.List;

public record ConversationMessagesResponse(
    List<MessageView> messages, boolean hasMore, long dbRowCount) {

  public static ConversationMessagesResponse empty() {
    return new ConversationMessagesResponse(List.of(), false, 0);
  }
}
