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
 * Account and billing information found in the contract.
 *
 * <p>{@code contactInfo} holds the general contact; billing and technical contacts are kept
 * separately because they are weighted differently when scoring.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AccountInfo {

  private String billingDetails;

  private List<String> accountNumbers;

  /** General contact for the account. */
  private ContactInfo contactInfo;

  private ContactInfo billingContact;

  private ContactInfo technicalContact;

  private Double confidenceScore;
}
