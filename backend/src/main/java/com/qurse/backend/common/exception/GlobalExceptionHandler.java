package com.qurse.backend.common.exception;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleUnexpectedException(Exception ex) {
    log.error("Unhandled exception", ex);
    return ResponseEntity.internalServerError()
        .body(ErrorResponse.of("An unexpected error occurred. Please try again later."));
  }

  @ExceptionHandler(BindException.class)
  public ResponseEntity<ErrorResponse> handleValidationErrors(BindException ex) {
    List<FieldViolation> violations =
        ex.getBindingResult().getFieldErrors().stream().map(this::toViolation).toList();
    if (violations.isEmpty()) {
      violations = List.of(new FieldViolation("body", "Invalid request payload"));
    }
    return ResponseEntity.badRequest()
        .body(new ErrorResponse("Invalid request", violations, null));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    log.debug("Rejected unreadable request body: {}", ex.getMessage());
    return ResponseEntity.badRequest()
        .body(
            new ErrorResponse(
                "Invalid request",
                List.of(new FieldViolation("body", "Malformed JSON request body")),
                null));
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
    return ResponseEntity.badRequest()
        .body(
            new ErrorResponse(
                "Invalid request",
                List.of(new FieldViolation(ex.getName(), "Invalid value")),
                null));
  }

  @ExceptionHandler(RequestValidationException.class)
  public ResponseEntity<ErrorResponse> handleRequestValidation(RequestValidationException ex) {
    return ResponseEntity.status(ex.getStatus())
        .body(new ErrorResponse(ex.getMessage(), ex.getViolations(), null));
  }

  @ExceptionHandler(RateLimitExceededException.class)
  public ResponseEntity<ErrorResponse> handleRateLimited(RateLimitExceededException ex) {
    return ResponseEntity.status(ex.getStatus())
        .headers(ex.getHeaders())
        .body(new ErrorResponse(ex.getMessage(), null, ex.getRateLimitInfo()));
  }

  @ExceptionHandler(ChatApiException.class)
  public ResponseEntity<ErrorResponse> handleChatApiException(ChatApiException ex) {
    if (ex.getStatus().is5xxServerError()) {
      log.error("Request failed with status {}", ex.getStatus().value(), ex);
    }
    return ResponseEntity.status(ex.getStatus()).body(ErrorResponse.of(ex.getMessage()));
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ErrorResponse> handleResponseStatusException(ResponseStatusException ex) {
    String reason =
        ex.getReason() != null
            ? ex.getReason()
            : HttpStatus.valueOf(ex.getStatusCode().value()).getReasonPhrase();
    return ResponseEntity.status(ex.getStatusCode()).body(ErrorResponse.of(reason));
  }

  private FieldViolation toViolation(FieldError error) {
    String message = error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value";
    return new FieldViolation(error.getField(), message);
  }
}
