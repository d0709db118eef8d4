package com.flamingo.ai.talkpdf.service.storage;

/** Opaque object storage for uploaded documents and generated audio. */
public interface BlobStore {

  /**
   * Reads a stored object.
   *
   * @throws BlobStorageException when the object is missing or unreadable
   */
  byte[] download(String ref);

  /**
   * Stores an object, replacing any previous content under the same reference.
   *
   * @return the reference of the stored object
   * @throws BlobStorageException when the write fails
   */
  String upload(String ref, byte[] content, String contentType);
}
