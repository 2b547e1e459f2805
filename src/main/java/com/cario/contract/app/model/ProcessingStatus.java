package com.cario.contract.app.model;

/** Lifecycle status of a contract record. */
public enum ProcessingStatus {
  PENDING,
  PROCESSING,
  COMPLETED,
  FAILED;

  /** True while the record is still moving through the pipeline. */
  public boolean isInFlight() {
    return this == PENDING || this == PROCESSING;
  }
}
