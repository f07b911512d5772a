package com.flamingo.ai.ragdocs.exception;

/** Exception thrown when a search request is rejected. */
public class SearchException extends RuntimeException {

  private final String userMessage;

  public SearchException(String message) {
    super(message);
    this.userMessage = message;
  }

  public SearchException(String message, String userMessage) {
    super(message);
    this.userMessage = userMessage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
