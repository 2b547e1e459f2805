package com.cario.contract.app.service;

import com.cario.contract.app.error.ProcessingTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/** Cooperative soft time limit for one processing attempt. */
public final class ProcessingDeadline {

  private final Clock clock;
  private final Instant expiresAt;
  private final Duration limit;

  private ProcessingDeadline(Clock clock, Instant expiresAt, Duration limit) {
    this.clock = clock;
    this.expiresAt = expiresAt;
    this.limit = limit;
  }

  /** Deadline {@code limit} from now. */
  public static ProcessingDeadline after(Clock clock, Duration limit) {
    return new ProcessingDeadline(clock, clock.instant().plus(limit), limit);
  }

  /** A deadline that never expires. */
  public static ProcessingDeadline none(Clock clock) {
    return new ProcessingDeadline(clock, Instant.MAX, Duration.ZERO);
  }

  public boolean isExpired() {
    return clock.instant().isAfter(expiresAt);
  }

  /**
   * @param stage name of the stage about to run, for the error message
   * @throws ProcessingTimeoutException if the deadline has passed
   */
  public void check(String stage) {
    if (isExpired()) {
      throw new ProcessingTimeoutException(stage, limit);
    }
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }
}
