package com.scholary.audiobook.api;

import com.scholary.audiobook.job.JobNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<ApiError> handleJobNotFound(
      JobNotFoundException ex, HttpServletRequest request) {
    LOGGER.warn("Job not found: {}", ex.getJobId());
    return error(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND", ex.getMessage(), List.of(), request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleInvalidBody(
      MethodArgumentNotValidException ex, HttpServletRequest request) {
    List<String> details =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .toList();
    LOGGER.warn("Rejected request {}: {}", request.getRequestURI(), details);
    return error(
        HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Request is invalid", details, request);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ApiError> handleConstraintViolation(
      ConstraintViolationException ex, HttpServletRequest request) {
    List<String> details =
        ex.getConstraintViolations().stream()
            .map(violation -> violation.getPropertyPath() + ": " + violation.getMessage())
            .toList();
    return error(
        HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Request is invalid", details, request);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> handleUnreadable(
      HttpMessageNotReadableException ex, HttpServletRequest request) {
    LOGGER.warn("Unreadable request body on {}: {}", request.getRequestURI(), ex.getMessage());
    return error(
        HttpStatus.BAD_REQUEST,
        "MALFORMED_REQUEST",
        "Request body could not be parsed",
        List.of(),
        request);
  }

  private ResponseEntity<ApiError> error(
      HttpStatus status,
      String code,
      String message,
      List<String> details,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(new ApiError(code, message, details, request.getRequestURI(), Instant.now()));
  }
}
