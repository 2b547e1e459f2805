package com.cario.contract.app.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

/** Returned after a contract upload was accepted for processing. */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ContractUploadResult {
  private String contractId;
  private String message;
  private String filename;
  private long fileSize; // bytes
}
