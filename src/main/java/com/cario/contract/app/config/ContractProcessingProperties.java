package com.cario.contract.app.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for the processing pipeline, bound from {@code contract.processing.*}.
 *
 * <ul>
 *   <li>{@code maxRetries} – re-attempts after the first try (3 attempts in total by default)
 *   <li>{@code retryBackoff} – fixed delay before a re-attempt
 *   <li>{@code softTimeLimit} – cooperative deadline checked between stages
 *   <li>{@code hardTimeLimit} – watchdog that interrupts the worker thread
 *   <li>{@code extractedTextMaxChars} – cap on the raw text stored with a record
 * </ul>
 */
@Data
@ConfigurationProperties(prefix = "contract.processing")
public class ContractProcessingProperties {

  private int maxRetries = 2;

  private Duration retryBackoff = Duration.ofSeconds(60);

  private Duration softTimeLimit = Duration.ofSeconds(540);

  private Duration hardTimeLimit = Duration.ofSeconds(600);

  private int extractedTextMaxChars = 5000;

  private Retry retry = new Retry();

  @Data
  public static class Retry {
    /** When true, PERMANENT errors end the run without using the remaining attempts. */
    private boolean failFastOnPermanent = false;
  }
}
