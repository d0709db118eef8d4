package com.flamingo.ai.talkpdf.service.storage;

/** Failure reading or writing the blob store. */
public class BlobStorageException extends RuntimeException {

  public BlobStorageException(String message) {
    super(message);
  }

  public BlobStorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
