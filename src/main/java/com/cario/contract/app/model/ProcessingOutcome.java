package com.cario.contract.app.model;

import com.cario.contract.app.error.ContractIntelligenceException;
import java.time.Duration;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Typed result of one processing attempt.
 *
 * <p>The orchestrator decides the kind; the dispatcher only acts on it (schedule a re-attempt or
 * release the contract id).
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ProcessingOutcome {

  public enum Kind {
    SUCCESS,
    RETRYABLE_FAILURE,
    TERMINAL_FAILURE
  }

  private final Kind kind;
  private final CompletenessScore score;
  private final ContractIntelligenceException error;
  private final int attemptsRemaining;
  private final Duration retryAfter;

  public static ProcessingOutcome success(CompletenessScore score) {
    return new ProcessingOutcome(Kind.SUCCESS, score, null, 0, null);
  }

  public static ProcessingOutcome retryable(
      ContractIntelligenceException error, int attemptsRemaining, Duration retryAfter) {
    return new ProcessingOutcome(
        Kind.RETRYABLE_FAILURE, null, error, attemptsRemaining, retryAfter);
  }

  public static ProcessingOutcome terminal(ContractIntelligenceException error) {
    return new ProcessingOutcome(Kind.TERMINAL_FAILURE, null, error, 0, null);
  }

  public boolean isSuccess() {
    return kind == Kind.SUCCESS;
  }

  public boolean isRetryable() {
    return kind == Kind.RETRYABLE_FAILURE;
  }
}
