package com.qurse.backend.common.exception;

import org.springframework.http.HttpStatus;

public class PersistenceFailureException extends ChatApiException {

  public PersistenceFailureException(String message, Throwable cause) {
    super(HttpStatus.INTERNAL_SERVER_ERROR, message, cause);
  }
}
