package com.cario.contract.app.repository.dynamodb;

import com.cario.contract.app.model.ContractDraft;
import java.time.Instant;
import java.util.List;
import lombok.*;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.*;

/**
 * Table row for one submitted contract. Every field is boxed so that partial items written with
 * {@code ignoreNulls} only touch the attributes they carry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class ContractRecordItem {

  public static final String ATTR_CONTRACT_ID = "contractId";
  public static final String ATTR_ERROR_MESSAGE = "errorMessage";
  public static final String ATTR_PROCESSING_ENDED_AT = "processingEndedAt";
  public static final String ATTR_PROCESSING_TIME_SECONDS = "processingTimeSeconds";

  /** Partition key: UUID assigned at submission. */
  private String contractId;

  /** Submission metadata. */
  private String filename;

  private String contentType;
  private Long fileSize;
  private String documentKey;
  private String documentUri;

  /** PENDING | PROCESSING | COMPLETED | FAILED. */
  private String status;

  private Integer progress;
  private Integer attempt;

  /** Scoring results. */
  private Double completenessScore;

  private ScoreBreakdownItem scoreBreakdown;
  private List<String> missingFields;

  /** Extracted fields, JSON encoded. */
  private ContractDraft draft;

  private String errorMessage;

  private Instant submittedAt;
  private Instant processingStartedAt;
  private Instant processingEndedAt;
  private Double processingTimeSeconds;
  private Instant updatedAt;

  // ---------- DynamoDB mapping ----------

  @DynamoDbPartitionKey
  @DynamoDbAttribute(ATTR_CONTRACT_ID)
  public String getContractId() {
    return contractId;
  }

  @DynamoDbAttribute("filename")
  public String getFilename() {
    return filename;
  }

  @DynamoDbAttribute("contentType")
  public String getContentType() {
    return contentType;
  }

  @DynamoDbAttribute("fileSize")
  public Long getFileSize() {
    return fileSize;
  }

  @DynamoDbAttribute("documentKey")
  public String getDocumentKey() {
    return documentKey;
  }

  @DynamoDbAttribute("documentUri")
  public String getDocumentUri() {
    return documentUri;
  }

  @DynamoDbAttribute("status")
  public String getStatus() {
    return status;
  }

  @DynamoDbAttribute("progress")
  public Integer getProgress() {
    return progress;
  }

  @DynamoDbAttribute("attempt")
  public Integer getAttempt() {
    return attempt;
  }

  @DynamoDbAttribute("completenessScore")
  public Double getCompletenessScore() {
    return completenessScore;
  }

  @DynamoDbAttribute("scoreBreakdown")
  public ScoreBreakdownItem getScoreBreakdown() {
    return scoreBreakdown;
  }

  @DynamoDbAttribute("missingFields")
  public List<String> getMissingFields() {
    return missingFields;
  }

  @DynamoDbAttribute("draft")
  @DynamoDbConvertedBy(ContractDraftAttributeConverter.class)
  public ContractDraft getDraft() {
    return draft;
  }

  @DynamoDbAttribute(ATTR_ERROR_MESSAGE)
  public String getErrorMessage() {
    return errorMessage;
  }

  @DynamoDbAttribute("submittedAt")
  public Instant getSubmittedAt() {
    return submittedAt;
  }

  @DynamoDbAttribute("processingStartedAt")
  public Instant getProcessingStartedAt() {
    return processingStartedAt;
  }

  @DynamoDbAttribute(ATTR_PROCESSING_ENDED_AT)
  public Instant getProcessingEndedAt() {
    return processingEndedAt;
  }

  @DynamoDbAttribute(ATTR_PROCESSING_TIME_SECONDS)
  public Double getProcessingTimeSeconds() {
    return processingTimeSeconds;
  }

  @DynamoDbAttribute("updatedAt")
  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
