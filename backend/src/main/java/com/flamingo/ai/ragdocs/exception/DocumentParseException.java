package com.flamingo.ai.ragdocs.exception;

/**
 * Exception raised for malformed structured data: document frontmatter or a fingerprint cache
 * entry. Callers recover by substituting an empty value.
 */
public class DocumentParseException extends RuntimeException {

  public DocumentParseException(String message) {
    super(message);
  }

  public DocumentParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
