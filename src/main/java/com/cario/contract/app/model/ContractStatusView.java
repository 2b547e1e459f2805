package com.cario.contract.app.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Polling view of a contract record. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ContractStatusView {

  private String contractId;

  private ProcessingStatus status;

  private Integer progress;

  private Integer attempt;

  private String errorMessage;

  private Instant submittedAt;

  private Double processingTimeSeconds;

  public static ContractStatusView of(ContractRecord record) {
    return ContractStatusView.builder()
        .contractId(record.getContractId())
        .status(record.getStatus())
        .progress(record.getProgress())
        .attempt(record.getAttempt())
        .errorMessage(record.getErrorMessage())
        .submittedAt(record.getSubmittedAt())
        .processingTimeSeconds(record.getProcessingTimeSeconds())
        .build();
  }
}
