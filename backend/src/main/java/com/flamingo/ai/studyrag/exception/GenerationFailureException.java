package com.flamingo.ai.studyrag.exception;

/** Exception thrown when the answer generation service fails. */
public class GenerationFailureException extends RuntimeException {

  public GenerationFailureException(String message) {
    super(message);
  }

  public GenerationFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}
