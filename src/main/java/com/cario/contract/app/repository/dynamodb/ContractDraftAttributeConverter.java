package com.cario.contract.app.repository.dynamodb;

import com.cario.contract.app.model.ContractDraft;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import software.amazon.awssdk.enhanced.dynamodb.AttributeConverter;
import software.amazon.awssdk.enhanced.dynamodb.AttributeValueType;
import software.amazon.awssdk.enhanced.dynamodb.EnhancedType;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Stores a {@link ContractDraft} as a single JSON string attribute (snake_case keys, the same shape
 * the extractor produces).
 */
public class ContractDraftAttributeConverter implements AttributeConverter<ContractDraft> {

  private static final ObjectMapper MAPPER =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  @Override
  public AttributeValue transformFrom(ContractDraft input) {
    try {
      return AttributeValue.fromS(MAPPER.writeValueAsString(input));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Unable to serialize contract draft", e);
    }
  }

  @Override
  public ContractDraft transformTo(AttributeValue input) {
    if (input == null || input.s() == null) return null;
    try {
      return MAPPER.readValue(input.s(), ContractDraft.class);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Unable to read contract draft attribute", e);
    }
  }

  @Override
  public EnhancedType<ContractDraft> type() {
    return EnhancedType.of(ContractDraft.class);
  }

  @Override
  public AttributeValueType attributeValueType() {
    return AttributeValueType.S;
  }
}
