package com.cario.contract.app.error;

public class ContractNotFoundException extends ContractIntelligenceException {

  private final String contractId;

  public ContractNotFoundException(String contractId) {
    super(ErrorCode.CONTRACT_NOT_FOUND, "Contract not found: " + contractId);
    this.contractId = contractId;
  }

  public String getContractId() {
    return contractId;
  }
}
