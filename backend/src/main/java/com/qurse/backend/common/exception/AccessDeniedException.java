package com.qurse.backend.common.exception;

import org.springframework.http.HttpStatus;

/** Authentication, subscription or ownership failure. */
public class AccessDeniedException extends ChatApiException {

  public AccessDeniedException(HttpStatus status, String message) {
    super(status, message);
  }

  public static AccessDeniedException authenticationRequired(String message) {
    return new AccessDeniedException(HttpStatus.UNAUTHORIZED, message);
  }

  public static AccessDeniedException forbidden(String message) {
    return new AccessDeniedException(HttpStatus.FORBIDDEN, message);
  }
}
