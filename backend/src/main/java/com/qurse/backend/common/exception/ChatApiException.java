package com.qurse.backend.common.exception;

import org.springframework.http.HttpStatus;

/** Base type for failures that carry their own HTTP status and a client-safe message. */
public abstract class ChatApiException extends RuntimeException {

  private final HttpStatus status;

  protected ChatApiException(HttpStatus status, String message) {
    super(message);
    this.status = status;
  }

  protected ChatApiException(HttpStatus status, String message, Throwable cause) {
    super(message, cause);
    this.status = status;
  }

  public HttpStatus getStatus() {
    return status;
  }
}
