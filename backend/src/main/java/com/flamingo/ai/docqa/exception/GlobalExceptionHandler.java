package com.flamingo.ai.docqa.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps pipeline exceptions to {@link ApiError} responses. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(DocumentNotFoundException.class)
  public ResponseEntity<ApiError> handleDocumentNotFound(
      DocumentNotFoundException ex, HttpServletRequest request) {
    String errorId = track("document_not_found");
    log.warn("Document not found [{}]: {}", errorId, ex.getDocumentId());
    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.DOCUMENT_NOT_FOUND, "Document not found", request);
  }

  @ExceptionHandler(DocumentProcessingException.class)
  public ResponseEntity<ApiError> handleDocumentProcessing(
      DocumentProcessingException ex, HttpServletRequest request) {
    String errorId = track("document_processing");
    log.error("Document processing error [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.DOCUMENT_PROCESSING_ERROR,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(RagValidationException.class)
  public ResponseEntity<ApiError> handleRagValidation(
      RagValidationException ex, HttpServletRequest request) {
    String errorId = track("validation_error");
    log.warn("Invalid request [{}]: {}", errorId, ex.getMessage());
    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getUserMessage(), request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {
    String errorId = track("validation_error");
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");
    log.warn("Validation error [{}]: {}", errorId, message);
    return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<ApiError> handleMissingHeader(
      MissingRequestHeaderException ex, HttpServletRequest request) {
    String errorId = track("missing_owner");
    log.warn("Missing header [{}]: {}", errorId, ex.getHeaderName());
    return respond(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.MISSING_OWNER,
        "Header " + ex.getHeaderName() + " is required",
        request);
  }

  @ExceptionHandler(TransientProviderException.class)
  public ResponseEntity<ApiError> handleTransientProvider(
      TransientProviderException ex, HttpServletRequest request) {
    String errorId = track(ex.isRateLimited() ? "provider_rate_limited" : "provider_transient");
    log.error(
        "Provider {} failed after retries [{}]: {}",
        ex.getProvider(),
        errorId,
        ex.getMessage(),
        ex);
    String code =
        ex.isRateLimited() ? ApiError.PROVIDER_RATE_LIMITED : ApiError.PROVIDER_UNAVAILABLE;
    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        code,
        "Service is temporarily busy. Please try again in a moment.",
        request);
  }

  @ExceptionHandler(ProviderUnavailableException.class)
  public ResponseEntity<ApiError> handleProviderUnavailable(
      ProviderUnavailableException ex, HttpServletRequest request) {
    String errorId = track("provider_unavailable");
    log.error("Provider {} unavailable [{}]: {}", ex.getProvider(), errorId, ex.getMessage(), ex);
    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.PROVIDER_UNAVAILABLE,
        "AI service is temporarily unavailable. Please try again later.",
        request);
  }

  @ExceptionHandler(RagPipelineException.class)
  public ResponseEntity<ApiError> handlePipeline(
      RagPipelineException ex, HttpServletRequest request) {
    String errorId = track("pipeline_failed");
    log.error("Query pipeline failed [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.PIPELINE_FAILED,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {
    String errorId = track("internal_error");
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> respond(
      HttpStatus status, String errorId, String code, String message, HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private String track(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
