package com.cario.contract.app.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Structured, possibly partial, output of contract field extraction.
 *
 * <p>Every field is optional; a {@code null} means the extractor did not find it in the document.
 * The JSON form uses snake_case keys and is also the schema the extraction model is asked to
 * produce.
 *
 * <ul>
 *   <li>{@code contractTitle} – Title as written on the document
 *   <li>{@code contractType} – e.g. "Service Agreement", "Master Services Agreement"
 *   <li>{@code customer} / {@code vendor} – The two contracting parties
 *   <li>{@code accountInfo} – Billing and contact details
 *   <li>{@code financialDetails} – Line items, totals and currency
 *   <li>{@code paymentStructure} – Terms, schedules and payment methods
 *   <li>{@code revenueClassification} – Recurring vs one-time, renewal terms
 *   <li>{@code sla} – Service level terms
 * </ul>
 *
 * @author Shaji Nair
 * @version 1.0
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ContractDraft {

  private String contractTitle;

  private String contractType;

  /** Short free-form summary of what the contract covers. */
  private String description;

  private ContractDates contractDates;

  private PartyInfo customer;

  private PartyInfo vendor;

  private AccountInfo accountInfo;

  private FinancialDetails financialDetails;

  private PaymentStructure paymentStructure;

  private RevenueClassification revenueClassification;

  private ServiceLevelTerms sla;

  /** Raw document text the draft was extracted from (may be truncated). */
  private String extractedText;

  /** A draft with every field absent. */
  public static ContractDraft empty() {
    return new ContractDraft();
  }
}
