package com.cario.contract.app.api;

import com.cario.contract.app.model.ContractRecord;
import com.cario.contract.app.model.ContractStatusView;
import com.cario.contract.app.model.ContractUploadResult;
import com.cario.contract.app.service.ContractStatusService;
import com.cario.contract.app.service.ContractSubmissionService;
import com.cario.contract.app.service.DocumentStorageService;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

/**
 * Contract upload and polling endpoints.
 *
 * <p>Errors are rendered by {@link com.cario.contract.app.error.GlobalExceptionHandler}; a result
 * requested before it is ready answers 202 with the current status and progress.
 */
@Log4j2
@Validated
@RestController
@RequestMapping("/contracts")
@RequiredArgsConstructor
public class ContractController {

  private final ContractSubmissionService submissionService;
  private final ContractStatusService statusService;
  private final DocumentStorageService storageService;

  // ------------------------------------------------------------
  // /contracts/upload
  // ------------------------------------------------------------
  @PostMapping(
      path = "/upload",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ContractUploadResult> upload(
      @RequestPart("file") @NotNull MultipartFile file) {
    log.info(
        "contracts.upload filename={} size={} contentType={}",
        file.getOriginalFilename(),
        file.getSize(),
        file.getContentType());
    ContractUploadResult result = submissionService.submit(file);
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(result);
  }

  // ------------------------------------------------------------
  // /contracts/{contractId}/status
  // ------------------------------------------------------------
  @GetMapping(path = "/{contractId}/status", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ContractStatusView> getStatus(
      @PathVariable("contractId") @NotBlank String contractId) {
    return ResponseEntity.ok(statusService.getStatus(contractId));
  }

  // ------------------------------------------------------------
  // /contracts/{contractId}
  // ------------------------------------------------------------
  @GetMapping(path = "/{contractId}", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ContractRecord> getContract(
      @PathVariable("contractId") @NotBlank String contractId) {
    return ResponseEntity.ok(statusService.getCompleted(contractId));
  }

  // ------------------------------------------------------------
  // /contracts/{contractId}/download
  // ------------------------------------------------------------
  @GetMapping(path = "/{contractId}/download")
  public ResponseEntity<Void> download(@PathVariable("contractId") @NotBlank String contractId) {
    ContractRecord record = statusService.getRecord(contractId);
    String url = storageService.presignDownload(record.getDocumentKey(), record.getFilename());
    log.info("contracts.download contractId={} key={}", contractId, record.getDocumentKey());
    return ResponseEntity.status(HttpStatus.FOUND).location(URI.create(url)).build();
  }
}
