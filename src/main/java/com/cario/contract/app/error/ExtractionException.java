package com.cario.contract.app.error;

/** Text detection or field extraction failed for a document. */
public class ExtractionException extends ContractIntelligenceException {

  public enum Kind {
    TRANSIENT,
    PERMANENT
  }

  private final Kind kind;

  public ExtractionException(Kind kind, String message) {
    super(codeFor(kind), message);
    this.kind = kind;
  }

  public ExtractionException(Kind kind, String message, Throwable cause) {
    super(codeFor(kind), message, cause);
    this.kind = kind;
  }

  public static ExtractionException transientFailure(String message, Throwable cause) {
    return new ExtractionException(Kind.TRANSIENT, message, cause);
  }

  public static ExtractionException permanentFailure(String message, Throwable cause) {
    return new ExtractionException(Kind.PERMANENT, message, cause);
  }

  public Kind getKind() {
    return kind;
  }

  private static ErrorCode codeFor(Kind kind) {
    return kind == Kind.TRANSIENT ? ErrorCode.EXTRACTION_TRANSIENT : ErrorCode.EXTRACTION_PERMANENT;
  }
}
