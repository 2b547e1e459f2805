package com.cario.contract.app.model;

import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update of a {@link ContractRecord}. Only non-null fields are written.
 *
 * <p>{@code clearFailure} removes {@code errorMessage}, {@code processingEndedAt} and {@code
 * processingTimeSeconds} in the same write, which is how a re-attempt drops the previous failure.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ContractRecordUpdate {

  private ProcessingStatus status;

  private Integer progress;

  private Integer attempt;

  private Double completenessScore;

  private ScoreBreakdown scoreBreakdown;

  private List<String> missingFields;

  private ContractDraft draft;

  private String errorMessage;

  private Instant processingStartedAt;

  private Instant processingEndedAt;

  private Double processingTimeSeconds;

  private boolean clearFailure;

  public static ContractRecordUpdate progress(int progress) {
    return ContractRecordUpdate.builder().progress(progress).build();
  }
}
