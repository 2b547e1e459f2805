package com.cario.contract.app.repository.dynamodb;

import lombok.*;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.*;

/** Nested map attribute holding the five category scores. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class ScoreBreakdownItem {

  private Double financialCompleteness;
  private Double partyIdentification;
  private Double paymentTerms;
  private Double slaDefinition;
  private Double contactInformation;

  @DynamoDbAttribute("financialCompleteness")
  public Double getFinancialCompleteness() {
    return financialCompleteness;
  }

  @DynamoDbAttribute("partyIdentification")
  public Double getPartyIdentification() {
    return partyIdentification;
  }

  @DynamoDbAttribute("paymentTerms")
  public Double getPaymentTerms() {
    return paymentTerms;
  }

  @DynamoDbAttribute("slaDefinition")
  public Double getSlaDefinition() {
    return slaDefinition;
  }

  @DynamoDbAttribute("contactInformation")
  public Double getContactInformation() {
    return contactInformation;
  }
}
