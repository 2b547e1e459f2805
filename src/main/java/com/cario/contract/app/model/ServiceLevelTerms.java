package com.cario.contract.app.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Service Level Agreement terms.
 *
 * <p>Serialized under the {@code sla} key of a {@link ContractDraft}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ServiceLevelTerms {

  private List<PerformanceMetric> performanceMetrics;

  private List<String> penaltyClauses;

  private String supportTerms;

  private String uptimeGuarantee;

  private String responseTime;

  private String resolutionTime;

  private Double confidenceScore;
}
