package com.cario.contract.app.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Text detected in a contract document. Includes:
 *
 * <ul>
 *   <li>The page-tagged text ({@code --- Page N ---} headers, one line per detected LINE block)
 *   <li>Page and line counts
 *   <li>Confidence statistics for the kept lines
 * </ul>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentText {

  private String text;

  private int pageCount;

  private int lineCount;

  /** Average confidence (0-100) of the kept lines. */
  private double averageConfidence;

  private double minConfidence;

  /** Textract job id for async (PDF) detection; {@code null} for sync calls. */
  private String jobId;
}
