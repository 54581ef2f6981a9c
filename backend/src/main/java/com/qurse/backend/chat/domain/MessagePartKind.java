package com.qurse.backend.chat.domain;

public enum MessagePartKind {
  TEXT("text"),
  REASONING("reasoning"),
  TOOL_INVOCATION("tool-invocation"),
  FILE("file");

  private final String wireName;

  MessagePartKind(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }
}
