package com.qurse.backend.chat.domain;

public record FilePart(String mediaType, String url, String filename) implements MessagePart {

  @Override
  public MessagePartKind kind() {
    return MessagePartKind.FILE;
  }
}
