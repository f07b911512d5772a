package com.flamingo.ai.ragdocs.exception;

/** Exception thrown when the chunk index cannot be created or has an incompatible mapping. */
public class SchemaException extends RuntimeException {

  private final String indexName;

  public SchemaException(String indexName, String message) {
    super(message);
    this.indexName = indexName;
  }

  public SchemaException(String indexName, String message, Throwable cause) {
    super(message, cause);
    this.indexName = indexName;
  }

  public String getIndexName() {
    return indexName;
  }
}
