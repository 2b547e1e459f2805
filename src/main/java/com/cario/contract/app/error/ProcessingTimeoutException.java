package com.cario.contract.app.error;

import java.time.Duration;

/** An attempt ran past its soft time limit. */
public class ProcessingTimeoutException extends ContractIntelligenceException {

  public ProcessingTimeoutException(String stage, Duration limit) {
    super(
        ErrorCode.PROCESSING_TIMEOUT,
        "Processing exceeded soft time limit of " + limit.toSeconds() + "s at stage " + stage);
  }
}
