package com.cario.contract.app.error;

/**
 * Error codes surfaced by the service.
 *
 * <p>The code string is what clients see in {@link ErrorResponse#getCode()}; the category drives
 * retry eligibility inside the processing pipeline.
 */
public enum ErrorCode {

  // ---- Upload / input ----
  INVALID_DOCUMENT("INVALID_DOCUMENT", "Only PDF files are supported", ErrorCategory.PERMANENT),
  DOCUMENT_TOO_LARGE("DOCUMENT_TOO_LARGE", "File size exceeds maximum", ErrorCategory.PERMANENT),
  EMPTY_DOCUMENT("EMPTY_DOCUMENT", "Empty file uploaded", ErrorCategory.PERMANENT),
  VALIDATION_ERROR("VALIDATION_ERROR", "Validation error", ErrorCategory.PERMANENT),

  // ---- Records ----
  CONTRACT_NOT_FOUND("CONTRACT_NOT_FOUND", "Contract not found", ErrorCategory.PERMANENT),
  CONTRACT_NOT_READY(
      "CONTRACT_NOT_READY", "Contract processing not yet completed", ErrorCategory.TRANSIENT),
  CONTRACT_PROCESSING_FAILED(
      "CONTRACT_PROCESSING_FAILED", "Contract processing failed", ErrorCategory.PERMANENT),
  DUPLICATE_CONTRACT("DUPLICATE_CONTRACT", "Contract already exists", ErrorCategory.PERMANENT),

  // ---- Pipeline ----
  EXTRACTION_TRANSIENT(
      "EXTRACTION_TRANSIENT", "Contract extraction failed temporarily", ErrorCategory.TRANSIENT),
  EXTRACTION_PERMANENT(
      "EXTRACTION_PERMANENT", "Contract could not be extracted", ErrorCategory.PERMANENT),
  PROCESSING_TIMEOUT(
      "PROCESSING_TIMEOUT", "Processing exceeded its time limit", ErrorCategory.TRANSIENT),

  // ---- Infrastructure ----
  PERSISTENCE_ERROR("PERSISTENCE_ERROR", "Contract store unavailable", ErrorCategory.TRANSIENT),
  STORAGE_ERROR("STORAGE_ERROR", "Document storage unavailable", ErrorCategory.TRANSIENT),
  INTERNAL_ERROR("INTERNAL_ERROR", "Internal error", ErrorCategory.TRANSIENT);

  private final String code;
  private final String defaultMessage;
  private final ErrorCategory category;

  ErrorCode(String code, String defaultMessage, ErrorCategory category) {
    this.code = code;
    this.defaultMessage = defaultMessage;
    this.category = category;
  }

  public String getCode() {
    return code;
  }

  public String getDefaultMessage() {
    return defaultMessage;
  }

  public ErrorCategory getCategory() {
    return category;
  }

  public boolean isTransient() {
    return category == ErrorCategory.TRANSIENT;
  }
}
