package com.cario.contract.app.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Result of scoring a {@link ContractDraft}: total, per-category points and missing fields. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CompletenessScore {

  /** Sum of the breakdown, within [0, 100]. */
  private double total;

  private ScoreBreakdown breakdown;

  /** Human-readable gaps in checklist order, without duplicates. */
  private List<String> missingFields;
}
