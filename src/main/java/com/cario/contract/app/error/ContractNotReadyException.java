package com.cario.contract.app.error;

import com.cario.contract.app.model.ProcessingStatus;

/** The record exists but is still pending or processing. */
public class ContractNotReadyException extends ContractIntelligenceException {

  private final String contractId;
  private final ProcessingStatus status;
  private final Integer progress;

  public ContractNotReadyException(String contractId, ProcessingStatus status, Integer progress) {
    super(ErrorCode.CONTRACT_NOT_READY, "Contract processing not yet completed");
    this.contractId = contractId;
    this.status = status;
    this.progress = progress;
  }

  public String getContractId() {
    return contractId;
  }

  public ProcessingStatus getStatus() {
    return status;
  }

  public Integer getProgress() {
    return progress;
  }
}
