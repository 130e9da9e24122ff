package dev.personarank.config;

import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler that maps contract violations in ranking requests to RFC 9457 Problem
 * Detail responses.
 *
 * <p>Both kinds of violation are client errors (HTTP 400): a structurally malformed document (for
 * example a blank document id) and a request body failing bean validation.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  /**
   * Maps {@link IllegalArgumentException} to a 400 Bad Request Problem Detail.
   *
   * @param ex the exception thrown by input contract checks
   * @return a Problem Detail with HTTP 400 status and the exception message
   */
  @ExceptionHandler(IllegalArgumentException.class)
  ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    log.warn("Rejected ranking request: {}", ex.getMessage());
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  /**
   * Maps bean validation failures of a request body to a 400 Bad Request Problem Detail listing
   * every offending field.
   *
   * @param ex the validation exception raised for a {@code @Valid} body
   * @return a Problem Detail with HTTP 400 status and the joined field errors
   */
  @ExceptionHandler(MethodArgumentNotValidException.class)
  ProblemDetail handleInvalidBody(MethodArgumentNotValidException ex) {
    String detail =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .sorted()
            .collect(Collectors.joining(", "));
    log.warn("Rejected ranking request: {}", detail);
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Validation failed: " + detail);
  }
}
