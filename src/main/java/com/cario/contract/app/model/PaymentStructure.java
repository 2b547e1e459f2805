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
 * Payment terms and structure.
 *
 * <p>{@code schedules} carries structured entries; {@code dueDates} holds plain due-date strings
 * when the document only lists dates without amounts.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PaymentStructure {

  /** e.g. "Net 30", "Net 60", "Due on receipt". */
  private String paymentTerms;

  private List<PaymentSchedule> schedules;

  private List<String> dueDates;

  /** e.g. "Wire Transfer", "Check", "Credit Card". */
  private List<String> methods;

  private String bankingDetails;

  private String latePaymentPenalty;

  private Double confidenceScore;
}
