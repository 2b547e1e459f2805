package com.cario.contract.app.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Financial terms of the contract.
 *
 * <p>Amounts are kept as plain doubles in {@code currency}; no conversion or rounding is applied to
 * what the extractor returned.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FinancialDetails {

  private List<LineItem> lineItems;

  /** Total contract value. */
  private Double totalValue;

  /** ISO currency code, e.g. "USD". */
  private String currency;

  /** Free-form tax wording (e.g., "VAT 20% excluded"). */
  private String taxInfo;

  private Double taxAmount;

  private Double subtotal;

  /** Named additional fees → amount. */
  private Map<String, Double> additionalFees;

  private Double confidenceScore;
}
