package com.qurse.backend.common.exception;

import java.util.List;
import org.springframework.http.HttpStatus;

public class RequestValidationException extends ChatApiException {

  private final List<FieldViolation> violations;

  public RequestValidationException(List<FieldViolation> violations) {
    super(HttpStatus.BAD_REQUEST, "Invalid request");
    this.violations = List.copyOf(violations);
  }

  public RequestValidationException(String field, String message) {
    this(List.of(new FieldViolation(field, message)));
  }

  public List<FieldViolation> getViolations() {
    return violations;
  }
}
