package com.scholary.channel.insights.api;

import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps exceptions escaping the controllers to {@link ErrorResponse} bodies. */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    String details =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    LOGGER.warn("Validation failed: {}", details);
    return ResponseEntity.badRequest().body(new ErrorResponse("Validation failed", details));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    LOGGER.warn("Unreadable request body: {}", ex.getMessage());
    return ResponseEntity.badRequest()
        .body(new ErrorResponse("Malformed request body", ex.getMostSpecificCause().getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    LOGGER.warn("Bad request: {}", ex.getMessage());
    return ResponseEntity.badRequest().body(new ErrorResponse("Invalid request", ex.getMessage()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
    if (ex instanceof org.springframework.web.ErrorResponse) {
      // Framework errors such as unknown routes or wrong methods keep their own status.
      org.springframework.web.ErrorResponse framework = (org.springframework.web.ErrorResponse) ex;
      LOGGER.warn("Request rejected: {}", ex.getMessage());
      return ResponseEntity.status(framework.getStatusCode())
          .body(new ErrorResponse(framework.getBody().getTitle(), ex.getMessage()));
    }
    LOGGER.error("Unexpected error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ErrorResponse("An unexpected error occurred", ex.getClass().getSimpleName()));
  }
}
