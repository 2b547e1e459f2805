package com.cario.contract.app.service;

import com.cario.contract.app.model.ContractRecord;
import com.cario.contract.app.model.ContractUploadResult;
import com.cario.contract.app.model.DocumentRef;
import com.cario.contract.app.model.StoredDocument;
import com.cario.contract.app.repository.ContractRecordGateway;
import com.cario.contract.app.scheduler.ContractProcessingDispatcher;
import java.time.Clock;
import java.util.UUID;
import java.util.function.Supplier;
import lombok.extern.log4j.Log4j2;
import org.springframework.web.multipart.MultipartFile;

/**
 * Submission path: validate, store, create the PENDING record, enqueue processing.
 *
 * <p>The record is created before the first attempt is scheduled, so a client polling right after
 * the upload response always finds it. If the record cannot be created the stored upload is
 * removed again.
 */
@Log4j2
public class ContractSubmissionService {

  private final DocumentStorageService storage;
  private final ContractRecordGateway gateway;
  private final ContractProcessingDispatcher dispatcher;
  private final Clock clock;
  private final Supplier<String> idGenerator;

  public ContractSubmissionService(
      DocumentStorageService storage,
      ContractRecordGateway gateway,
      ContractProcessingDispatcher dispatcher,
      Clock clock) {
    this(storage, gateway, dispatcher, clock, () -> UUID.randomUUID().toString());
  }

  ContractSubmissionService(
      DocumentStorageService storage,
      ContractRecordGateway gateway,
      ContractProcessingDispatcher dispatcher,
      Clock clock,
      Supplier<String> idGenerator) {
    this.storage = storage;
    this.gateway = gateway;
    this.dispatcher = dispatcher;
    this.clock = clock;
    this.idGenerator = idGenerator;
  }

  public ContractUploadResult submit(MultipartFile file) {
    storage.validate(file);

    String contractId = idGenerator.get();
    log.info(
        "submission.start contractId={} filename={} size={}",
        contractId,
        file.getOriginalFilename(),
        file.getSize());

    StoredDocument stored = storage.store(contractId, file);

    ContractRecord record =
        ContractRecord.newPending(contractId, clock.instant()).toBuilder()
            .filename(file.getOriginalFilename())
            .contentType(stored.getContentType())
            .fileSize(stored.getSize())
            .documentKey(stored.getKey())
            .documentUri(stored.getS3Uri())
            .build();
    try {
      gateway.create(record);
    } catch (RuntimeException e) {
      discard(contractId, stored, e);
      throw e;
    }

    DocumentRef ref =
        DocumentRef.builder()
            .bucket(stored.getBucket())
            .key(stored.getKey())
            .contentType(stored.getContentType())
            .filename(file.getOriginalFilename())
            .build();
    boolean accepted = dispatcher.enqueue(contractId, ref);
    log.info("submission.queued contractId={} accepted={}", contractId, accepted);

    return ContractUploadResult.builder()
        .contractId(contractId)
        .message("Contract uploaded successfully. Processing started.")
        .filename(file.getOriginalFilename())
        .fileSize(file.getSize())
        .build();
  }

  /** Best-effort removal of a stored upload that no record points at. */
  private void discard(String contractId, StoredDocument stored, RuntimeException cause) {
    try {
      storage.delete(stored.getKey());
      log.warn(
          "submission.rollback contractId={} key={} reason={}",
          contractId,
          stored.getKey(),
          cause.getMessage());
    } catch (RuntimeException cleanup) {
      cause.addSuppressed(cleanup);
      log.error("submission.orphan contractId={} uri={}", contractId, stored.getS3Uri(), cleanup);
    }
  }
}
