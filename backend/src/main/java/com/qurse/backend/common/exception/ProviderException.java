package com.qurse.backend.common.exception;

import org.springframework.http.HttpStatus;

/** The model provider rejected the request. The provider's own message is never exposed. */
public class ProviderException extends ChatApiException {

  public static final String PUBLIC_MESSAGE = "The AI provider failed to process the request";

  public ProviderException(Throwable cause) {
    super(HttpStatus.BAD_GATEWAY, PUBLIC_MESSAGE, cause);
  }
}
