package com.qurse.backend.chat.access;

import org.springframework.http.HttpStatus;

public enum DenyReason {
  AUTH_REQUIRED(HttpStatus.UNAUTHORIZED, "Sign in to use this model"),
  SUBSCRIPTION_REQUIRED(HttpStatus.FORBIDDEN, "This model requires a Pro subscription"),
  RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, "Daily message limit reached");

  private final HttpStatus status;
  private final String message;

  DenyReason(HttpStatus status, String message) {
    this.status = status;
    this.message = message;
  }

  public HttpStatus status() {
    return status;
  }

  public String message() {
    return message;
  }
}
