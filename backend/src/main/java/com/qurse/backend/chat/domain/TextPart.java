package com.qurse.backend.chat.domain;

public record TextPart(String text) implements MessagePart {

  @Override
  public MessagePartKind kind() {
    return MessagePartKind.TEXT;
  }
}
