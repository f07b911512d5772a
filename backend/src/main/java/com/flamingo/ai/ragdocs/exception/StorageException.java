package com.flamingo.ai.ragdocs.exception;

/** Exception thrown when the fingerprint cache or the vector store cannot be read or written. */
public class StorageException extends RuntimeException {

  private final String userMessage;

  public StorageException(String message) {
    super(message);
    this.userMessage = "Document storage is temporarily unavailable. Please try again.";
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Document storage is temporarily unavailable. Please try again.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
