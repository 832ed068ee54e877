package com.flamingo.ai.studyrag.exception;

/** Exception thrown when the vector index cannot be read or written. */
public class IndexUnavailableException extends RuntimeException {

  private final String userMessage;

  public IndexUnavailableException(String message) {
    super(message);
    this.userMessage = "Search index is temporarily unavailable. Please try again.";
  }

  public IndexUnavailableException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Search index is temporarily unavailable. Please try again.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
