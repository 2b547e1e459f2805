package com.cario.contract.app.error;

/** The document store (S3) rejected or failed a read, write or presign. */
public class DocumentStorageException extends ContractIntelligenceException {

  public DocumentStorageException(String message, Throwable cause) {
    super(ErrorCode.STORAGE_ERROR, message, cause);
  }
}
