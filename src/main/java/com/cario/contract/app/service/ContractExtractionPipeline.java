package com.cario.contract.app.service;

import com.cario.contract.app.model.ContractDraft;
import com.cario.contract.app.model.DocumentRef;
import com.cario.contract.app.model.DocumentText;
import lombok.extern.log4j.Log4j2;

/**
 * Default {@link ContractExtractor}: Textract text detection followed by LLM field extraction.
 *
 * <p>The detected text is attached to the draft, cut to {@code extractedTextMaxChars}.
 */
@Log4j2
public class ContractExtractionPipeline implements ContractExtractor {

  private static final String STAGE = "extraction";

  private final TextractService textractService;
  private final ContractParserService parserService;
  private final int extractedTextMaxChars;

  public ContractExtractionPipeline(
      TextractService textractService,
      ContractParserService parserService,
      int extractedTextMaxChars) {
    this.textractService = textractService;
    this.parserService = parserService;
    this.extractedTextMaxChars = extractedTextMaxChars;
  }

  @Override
  public ContractDraft extract(DocumentRef document, ProcessingDeadline deadline) {
    log.info("extraction.start uri={}", document.toS3Uri());

    DocumentText text = textractService.extractText(document, deadline);
    deadline.check(STAGE);
    ContractDraft draft = parserService.parse(text.getText());
    if (draft == null) {
      draft = ContractDraft.empty();
    }
    draft.setExtractedText(truncate(text.getText(), extractedTextMaxChars));

    log.info(
        "extraction.done uri={} pages={} textChars={}",
        document.toS3Uri(),
        text.getPageCount(),
        text.getText().length());
    return draft;
  }

  static String truncate(String s, int max) {
    if (s == null || max < 0 || s.length() <= max) return s;
    return s.substring(0, max);
  }
}
