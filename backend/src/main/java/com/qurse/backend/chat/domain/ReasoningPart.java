package com.qurse.backend.chat.domain;

public record ReasoningPart(String text) implements MessagePart {

  @Override
  public MessagePartKind kind() {
    return MessagePartKind.REASONING;
  }
}
