package com.cario.contract.app.repository;

import com.cario.contract.app.model.ContractRecord;
import com.cario.contract.app.model.ContractRecordUpdate;
import java.util.Optional;

/**
 * Persistence port for {@link ContractRecord}s keyed by contract id.
 *
 * <p>Implementations provide per-record atomicity for each call; callers do no locking of their
 * own. Failures surface as {@link com.cario.contract.app.error.PersistenceException}.
 */
public interface ContractRecordGateway {

  Optional<ContractRecord> get(String contractId);

  /**
   * Persists a new record.
   *
   * @throws com.cario.contract.app.error.DuplicateContractException if the id already exists
   */
  void create(ContractRecord record);

  /** Merges the non-null fields of {@code update} into the record. */
  void upsert(String contractId, ContractRecordUpdate update);
}
