package com.cario.contract.app.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-category completeness points. Each value is already clamped to its category maximum.
 *
 * <ul>
 *   <li>{@code financialCompleteness} – at most {@value #FINANCIAL_MAX}
 *   <li>{@code partyIdentification} – at most {@value #PARTY_MAX}
 *   <li>{@code paymentTerms} – at most {@value #PAYMENT_MAX}
 *   <li>{@code slaDefinition} – at most {@value #SLA_MAX}
 *   <li>{@code contactInformation} – at most {@value #CONTACT_MAX}
 * </ul>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ScoreBreakdown {

  public static final double FINANCIAL_MAX = 30.0;
  public static final double PARTY_MAX = 25.0;
  public static final double PAYMENT_MAX = 20.0;
  public static final double SLA_MAX = 15.0;
  public static final double CONTACT_MAX = 10.0;

  private double financialCompleteness;

  private double partyIdentification;

  private double paymentTerms;

  private double slaDefinition;

  private double contactInformation;

  public double total() {
    return financialCompleteness
        + partyIdentification
        + paymentTerms
        + slaDefinition
        + contactInformation;
  }

  public static ScoreBreakdown zero() {
    return new ScoreBreakdown();
  }
}
