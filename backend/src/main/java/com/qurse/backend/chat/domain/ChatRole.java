package com.qurse.backend.chat.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ChatRole {
  USER,
  ASSISTANT,
  SYSTEM;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static ChatRole fromWireName(String value) {
    if (value == null) {
      return null;
    }
    for (ChatRole role : values()) {
      if (role.wireName().equalsIgnoreCase(value.trim())) {
        return role;
      }
    }
    throw new IllegalArgumentException("Unsupported role: " + value);
  }
}
