package com.qurse.backend.chat.dedup;

public enum DuplicateReason {
  STOP_MARKER("Duplicate of message with stop text"),
  LESS_CONTENT("Duplicate with less content"),
  KEPT_EARLIER("Duplicate (kept earlier message)");

  private final String description;

  DuplicateReason(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }
}
