package com.flamingo.ai.ragdocs.exception;

/** Exception thrown when the vector store cannot be reached at all. */
public class VectorStoreConnectionException extends StorageException {

  public VectorStoreConnectionException(String message) {
    super(message);
  }

  public VectorStoreConnectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
