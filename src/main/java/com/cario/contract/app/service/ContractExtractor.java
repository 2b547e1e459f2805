package com.cario.contract.app.service;

import com.cario.contract.app.model.ContractDraft;
import com.cario.contract.app.model.DocumentRef;

/** Turns a stored contract document into a structured draft. */
public interface ContractExtractor {

  /**
   * Extracts contract fields from the document.
   *
   * @param document where the original document is stored
   * @param deadline soft time limit of the running attempt, checked between blocking calls
   * @return the (possibly partial) draft, never {@code null}
   * @throws com.cario.contract.app.error.ExtractionException on transient or permanent failure
   * @throws com.cario.contract.app.error.ProcessingTimeoutException once the deadline passes
   */
  ContractDraft extract(DocumentRef document, ProcessingDeadline deadline);
}
