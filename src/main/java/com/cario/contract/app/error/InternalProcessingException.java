package com.cario.contract.app.error;

/** Wraps an unexpected runtime failure inside a processing attempt. */
public class InternalProcessingException extends ContractIntelligenceException {

  public InternalProcessingException(String message, Throwable cause) {
    super(ErrorCode.INTERNAL_ERROR, message, cause);
  }
}
