package com.cario.contract.app.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Unit of work handed to the orchestrator: which record, and where its document lives. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProcessingJob {

  private String contractId;

  private DocumentRef document;
}
