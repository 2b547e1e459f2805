package com.cario.contract.app.error;

/** The contract store could not be read or written. */
public class PersistenceException extends ContractIntelligenceException {

  public PersistenceException(String message, Throwable cause) {
    super(ErrorCode.PERSISTENCE_ERROR, message, cause);
  }
}
