package com.flamingo.ai.ragdocs.exception;

/** Exception thrown when a single documentation file cannot be read or segmented. */
public class DocumentProcessingException extends RuntimeException {

  private final String filePath;

  public DocumentProcessingException(String filePath, String message) {
    super(message);
    this.filePath = filePath;
  }

  public DocumentProcessingException(String filePath, String message, Throwable cause) {
    super(message, cause);
    this.filePath = filePath;
  }

  public String getFilePath() {
    return filePath;
  }
}
