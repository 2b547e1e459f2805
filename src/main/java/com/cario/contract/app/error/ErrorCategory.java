package com.cario.contract.app.error;

/** Whether a failure may succeed when the same work is attempted again. */
public enum ErrorCategory {
  /** Network, throttling, timeouts: worth another attempt. */
  TRANSIENT,
  /** Bad input or a definitive rejection: another attempt will fail the same way. */
  PERMANENT
}
