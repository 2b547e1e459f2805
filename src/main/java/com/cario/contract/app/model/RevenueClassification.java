package com.cario.contract.app.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Revenue and billing classification. Not part of the completeness score. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RevenueClassification {

  private Boolean recurringPayment;

  private Boolean oneTimePayment;

  /** e.g. "monthly", "annual". */
  private String subscriptionModel;

  private String billingCycle;

  private String renewalTerms;

  private Boolean autoRenewal;

  private String renewalNoticePeriod;

  private Double confidenceScore;
}
