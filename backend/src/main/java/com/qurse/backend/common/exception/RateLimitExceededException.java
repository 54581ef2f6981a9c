package com.qurse.backend.common.exception;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;

public class RateLimitExceededException extends ChatApiException {

  private final RateLimitInfo rateLimitInfo;
  private final HttpHeaders headers;

  public RateLimitExceededException(String message, RateLimitInfo rateLimitInfo, HttpHeaders headers) {
    super(HttpStatus.TOO_MANY_REQUESTS, message);
    this.rateLimitInfo = rateLimitInfo;
    this.headers = headers != null ? headers : new HttpHeaders();
  }

  public RateLimitInfo getRateLimitInfo() {
    return rateLimitInfo;
  }

  public HttpHeaders getHeaders() {
    return headers;
  }
}
