package com.qurse.backend.common.exception;

import org.springframework.http.HttpStatus;

public class ChatModeException extends ChatApiException {

  public ChatModeException(String chatMode) {
    super(HttpStatus.BAD_REQUEST, "Chat mode '" + chatMode + "' is not available");
  }
}
