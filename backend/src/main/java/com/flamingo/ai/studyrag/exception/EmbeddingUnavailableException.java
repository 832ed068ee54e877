package com.flamingo.ai.studyrag.exception;

/** Exception thrown when the embedding service cannot produce a vector after all retries. */
public class EmbeddingUnavailableException extends RuntimeException {

  private final int attempts;
  private final String userMessage;

  public EmbeddingUnavailableException(String message, int attempts, Throwable cause) {
    super(message, cause);
    this.attempts = attempts;
    this.userMessage = "Embedding service is temporarily unavailable. Please try again later.";
  }

  public EmbeddingUnavailableException(String message, Throwable cause) {
    this(message, 1, cause);
  }

  public int getAttempts() {
    return attempts;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
