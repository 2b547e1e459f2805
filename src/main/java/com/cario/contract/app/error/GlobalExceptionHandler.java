package com.cario.contract.app.error;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/**
 * Maps exceptions raised by controllers to {@link ErrorResponse} bodies.
 *
 * <p>Client errors are logged at WARN without stack traces; anything unexpected is logged at ERROR
 * with the cause.
 */
@Log4j2
@RestControllerAdvice
public class GlobalExceptionHandler {

  @ExceptionHandler(ContractNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleNotFound(
      ContractNotFoundException ex, HttpServletRequest request) {
    log.warn("api.error notFound contractId={}", ex.getContractId());
    return respond(
        HttpStatus.NOT_FOUND,
        ex.getErrorCode(),
        ex.getMessage(),
        request,
        Map.of("contractId", ex.getContractId()));
  }

  /** Not an error for the client: the result is simply not there yet. */
  @ExceptionHandler(ContractNotReadyException.class)
  public ResponseEntity<ErrorResponse> handleNotReady(
      ContractNotReadyException ex, HttpServletRequest request) {
    log.debug("api.notReady contractId={} status={}", ex.getContractId(), ex.getStatus());
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("contractId", ex.getContractId());
    meta.put("status", String.valueOf(ex.getStatus()));
    meta.put("progress", ex.getProgress() == null ? 0 : ex.getProgress());
    return respond(HttpStatus.ACCEPTED, ex.getErrorCode(), ex.getMessage(), request, meta);
  }

  @ExceptionHandler(ContractProcessingFailedException.class)
  public ResponseEntity<ErrorResponse> handleProcessingFailed(
      ContractProcessingFailedException ex, HttpServletRequest request) {
    log.warn("api.error processingFailed contractId={}", ex.getContractId());
    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        ex.getErrorCode(),
        ex.getMessage(),
        request,
        Map.of("contractId", ex.getContractId()));
  }

  @ExceptionHandler(InvalidDocumentException.class)
  public ResponseEntity<ErrorResponse> handleInvalidDocument(
      InvalidDocumentException ex, HttpServletRequest request) {
    log.warn("api.error invalidDocument code={} msg={}", ex.getErrorCode(), ex.getMessage());
    HttpStatus status =
        ex.getErrorCode() == ErrorCode.DOCUMENT_TOO_LARGE
            ? HttpStatus.PAYLOAD_TOO_LARGE
            : HttpStatus.BAD_REQUEST;
    return respond(status, ex.getErrorCode(), ex.getMessage(), request, null);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ErrorResponse> handleMaxUpload(
      MaxUploadSizeExceededException ex, HttpServletRequest request) {
    log.warn("api.error uploadTooLarge msg={}", ex.getMessage());
    return respond(
        HttpStatus.PAYLOAD_TOO_LARGE,
        ErrorCode.DOCUMENT_TOO_LARGE,
        ErrorCode.DOCUMENT_TOO_LARGE.getDefaultMessage(),
        request,
        null);
  }

  @ExceptionHandler(DuplicateContractException.class)
  public ResponseEntity<ErrorResponse> handleDuplicate(
      DuplicateContractException ex, HttpServletRequest request) {
    log.warn("api.error duplicate msg={}", ex.getMessage());
    return respond(HttpStatus.CONFLICT, ex.getErrorCode(), ex.getMessage(), request, null);
  }

  @ExceptionHandler({DocumentStorageException.class, PersistenceException.class})
  public ResponseEntity<ErrorResponse> handleUnavailable(
      ContractIntelligenceException ex, HttpServletRequest request) {
    log.error("api.error unavailable code={} msg={}", ex.getErrorCode(), ex.getMessage(), ex);
    return respond(
        HttpStatus.SERVICE_UNAVAILABLE, ex.getErrorCode(), ex.getMessage(), request, null);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleArgumentNotValid(
      MethodArgumentNotValidException ex, HttpServletRequest request) {
    List<ErrorResponse.FieldError> fieldErrors =
        ex.getBindingResult().getFieldErrors().stream()
            .map(
                fe ->
                    ErrorResponse.FieldError.builder()
                        .field(fe.getField())
                        .message(fe.getDefaultMessage())
                        .build())
            .toList();
    log.warn("api.error validation fields={}", fieldErrors.size());
    ErrorResponse body =
        base(HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_ERROR, "Validation failed", request)
            .fieldErrors(fieldErrors)
            .build();
    return ResponseEntity.badRequest().body(body);
  }

  @ExceptionHandler({
    ConstraintViolationException.class,
    MissingServletRequestPartException.class,
    IllegalArgumentException.class
  })
  public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
    log.warn("api.error badRequest msg={}", ex.getMessage());
    return respond(
        HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_ERROR, ex.getMessage(), request, null);
  }

  @ExceptionHandler(ContractIntelligenceException.class)
  public ResponseEntity<ErrorResponse> handleServiceException(
      ContractIntelligenceException ex, HttpServletRequest request) {
    log.error("api.error code={} msg={}", ex.getErrorCode(), ex.getMessage(), ex);
    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR, ex.getErrorCode(), ex.getMessage(), request, null);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
    log.error("api.error unexpected path={}", request.getRequestURI(), ex);
    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        ErrorCode.INTERNAL_ERROR,
        ErrorCode.INTERNAL_ERROR.getDefaultMessage(),
        request,
        null);
  }

  // -------- helpers --------

  private ResponseEntity<ErrorResponse> respond(
      HttpStatus status,
      ErrorCode code,
      String message,
      HttpServletRequest request,
      Map<String, Object> metadata) {
    return ResponseEntity.status(status)
        .body(base(status, code, message, request).metadata(metadata).build());
  }

  private static ErrorResponse.ErrorResponseBuilder base(
      HttpStatus status, ErrorCode code, String message, HttpServletRequest request) {
    return ErrorResponse.builder()
        .code(code.getCode())
        .message(message)
        .status(status.value())
        .timestamp(Instant.now())
        .path(request.getRequestURI());
  }
}
