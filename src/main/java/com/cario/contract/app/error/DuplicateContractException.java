package com.cario.contract.app.error;

public class DuplicateContractException extends ContractIntelligenceException {

  public DuplicateContractException(String contractId, Throwable cause) {
    super(ErrorCode.DUPLICATE_CONTRACT, "Contract already exists: " + contractId, cause);
  }
}
