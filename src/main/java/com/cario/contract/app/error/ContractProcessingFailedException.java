package com.cario.contract.app.error;

/** The record reached FAILED; the message carries the recorded error. */
public class ContractProcessingFailedException extends ContractIntelligenceException {

  private final String contractId;

  public ContractProcessingFailedException(String contractId, String errorMessage) {
    super(ErrorCode.CONTRACT_PROCESSING_FAILED, "Contract processing failed: " + errorMessage);
    this.contractId = contractId;
  }

  public String getContractId() {
    return contractId;
  }
}
