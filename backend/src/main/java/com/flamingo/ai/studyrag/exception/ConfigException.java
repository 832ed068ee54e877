package com.flamingo.ai.studyrag.exception;

/**
 * Exception thrown when the pipeline configuration is invalid.
 *
 * <p>Raised at startup for inconsistent chunk window sizes or when the embedding profile does not
 * match the one the vector index was built with. Never recovered.
 */
public class ConfigException extends RuntimeException {

  private final String setting;

  public ConfigException(String setting, String message) {
    super(message);
    this.setting = setting;
  }

  public ConfigException(String setting, String message, Throwable cause) {
    super(message, cause);
    this.setting = setting;
  }

  public String getSetting() {
    return setting;
  }
}
