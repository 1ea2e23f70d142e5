package com.cario.clinical.safety.api;

import com.cario.clinical.safety.review.ReviewTransitionException;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps gate and argument failures to HTTP statuses. */
@Log4j2
@RestControllerAdvice
public class ApiExceptionHandler {

  @ExceptionHandler(ReviewTransitionException.class)
  public ResponseEntity<ErrorResponse> handleTransition(ReviewTransitionException ex) {
    HttpStatus status =
        switch (ex.getReason()) {
          case UNKNOWN_DOCUMENT -> HttpStatus.NOT_FOUND;
          case DUPLICATE_DOCUMENT,
              ALREADY_REVIEWED,
              NOT_REVIEWED,
              ALREADY_SIGNED,
              NOT_SIGNED -> HttpStatus.CONFLICT;
        };
    log.info("api.transition.refused docId={} reason={}", ex.getDocumentId(), ex.getReason());
    ErrorResponse body =
        ErrorResponse.builder().message(ex.getMessage()).reason(ex.getReason().name()).build();
    return ResponseEntity.status(status).body(body);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
    String detail =
        ex.getBindingResult().getFieldErrors().stream()
            .map(e -> e.getField() + " " + e.getDefaultMessage())
            .collect(Collectors.joining(", "));
    return badRequest("Invalid request: " + detail);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    return badRequest("Request body could not be read");
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest(ex.getMessage());
  }

  private static ResponseEntity<ErrorResponse> badRequest(String message) {
    log.debug("api.bad_request msg={}", message);
    return ResponseEntity.badRequest().body(ErrorResponse.builder().message(message).build());
  }
}
