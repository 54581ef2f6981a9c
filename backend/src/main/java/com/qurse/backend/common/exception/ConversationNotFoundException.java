package com.qurse.backend.common.exception;

import org.springframework.http.HttpStatus;

public class ConversationNotFoundException extends ChatApiException {

  public ConversationNotFoundException() {
    super(HttpStatus.NOT_FOUND, "Conversation not found");
  }
}
