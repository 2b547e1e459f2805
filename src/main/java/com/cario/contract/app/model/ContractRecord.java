package com.cario.contract.app.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persisted lifecycle entity for one submitted contract.
 *
 * <p>The record tracks:
 *
 * <ul>
 *   <li>Submission metadata (file name, size, storage location)
 *   <li>Pipeline status, progress and attempt counter
 *   <li>Completeness score, per-category breakdown and missing fields
 *   <li>The extracted draft, populated only once the record is {@code COMPLETED}
 *   <li>Failure message and timings of the current attempt
 * </ul>
 *
 * <p>Created once at submission and afterwards mutated only by the processing orchestrator.
 *
 * @author Shaji Nair
 * @version 1.0
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ContractRecord {

  /** Opaque unique id assigned at submission. */
  private String contractId;

  private String filename;

  private String contentType;

  private Long fileSize;

  /** S3 key of the stored document. */
  private String documentKey;

  /** {@code s3://bucket/key} of the stored document. */
  private String documentUri;

  private ProcessingStatus status;

  /** 0..100, non-decreasing within one attempt. */
  private Integer progress;

  /** Number of attempts made before the current one (0-based). */
  private Integer attempt;

  private Double completenessScore;

  private ScoreBreakdown scoreBreakdown;

  private List<String> missingFields;

  /** Extracted fields; {@code null} until the record completes. Rendered flat in JSON. */
  @JsonUnwrapped private ContractDraft draft;

  /** Present only while status is {@code FAILED}. */
  private String errorMessage;

  private Instant submittedAt;

  private Instant processingStartedAt;

  private Instant processingEndedAt;

  private Double processingTimeSeconds;

  private Instant updatedAt;

  /**
   * Creates a new record in {@code PENDING} with zero progress.
   *
   * @param contractId the contract identifier
   * @param submittedAt submission time
   * @return a new record, not yet persisted
   */
  public static ContractRecord newPending(String contractId, Instant submittedAt) {
    return ContractRecord.builder()
        .contractId(contractId)
        .status(ProcessingStatus.PENDING)
        .progress(0)
        .attempt(0)
        .submittedAt(submittedAt)
        .updatedAt(submittedAt)
        .build();
  }
}
