package com.cario.contract.app.error;

/** Upload rejected: wrong type, empty, or too large. */
public class InvalidDocumentException extends ContractIntelligenceException {

  public InvalidDocumentException(ErrorCode errorCode) {
    super(errorCode);
  }

  public InvalidDocumentException(ErrorCode errorCode, String message) {
    super(errorCode, message);
  }
}
