package com.qurse.backend.common.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    String error, List<FieldViolation> validationErrors, RateLimitInfo rateLimitInfo) {

  public static ErrorResponse of(String error) {
    return new ErrorResponse(error, null, null);
  }
}
