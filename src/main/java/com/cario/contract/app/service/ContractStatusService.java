package com.cario.contract.app.service;

import com.cario.contract.app.error.ContractNotFoundException;
import com.cario.contract.app.error.ContractNotReadyException;
import com.cario.contract.app.error.ContractProcessingFailedException;
import com.cario.contract.app.model.ContractRecord;
import com.cario.contract.app.model.ContractStatusView;
import com.cario.contract.app.model.ProcessingStatus;
import com.cario.contract.app.repository.ContractRecordGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;

/** Read side for clients polling a contract. */
@Log4j2
@RequiredArgsConstructor
public class ContractStatusService {

  private final ContractRecordGateway gateway;

  /** Record for any status; throws if unknown. */
  public ContractRecord getRecord(String contractId) {
    validateId(contractId);
    return gateway.get(contractId).orElseThrow(() -> new ContractNotFoundException(contractId));
  }

  public ContractStatusView getStatus(String contractId) {
    ContractRecord record = getRecord(contractId);
    log.debug(
        "status.get contractId={} status={} progress={}",
        contractId,
        record.getStatus(),
        record.getProgress());
    return ContractStatusView.of(record);
  }

  /**
   * The completed record.
   *
   * @throws ContractNotReadyException while PENDING or PROCESSING
   * @throws ContractProcessingFailedException when FAILED
   */
  public ContractRecord getCompleted(String contractId) {
    ContractRecord record = getRecord(contractId);
    ProcessingStatus status = record.getStatus();
    if (status == null || status.isInFlight()) {
      throw new ContractNotReadyException(contractId, status, record.getProgress());
    }
    if (status == ProcessingStatus.FAILED) {
      throw new ContractProcessingFailedException(contractId, record.getErrorMessage());
    }
    return record;
  }

  private static void validateId(String contractId) {
    if (contractId == null || contractId.isBlank()) {
      throw new IllegalArgumentException("contractId is required");
    }
  }
}
