package com.cario.contract.app.error;

/** Base exception for the service. Carries an {@link ErrorCode} for mapping and retry decisions. */
public abstract class ContractIntelligenceException extends RuntimeException {

  private final ErrorCode errorCode;

  protected ContractIntelligenceException(ErrorCode errorCode) {
    super(errorCode.getDefaultMessage());
    this.errorCode = errorCode;
  }

  protected ContractIntelligenceException(ErrorCode errorCode, String message) {
    super(message);
    this.errorCode = errorCode;
  }

  protected ContractIntelligenceException(ErrorCode errorCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }

  public ErrorCode getErrorCode() {
    return errorCode;
  }

  public ErrorCategory getCategory() {
    return errorCode.getCategory();
  }

  public boolean isTransient() {
    return errorCode.isTransient();
  }
}
