package com.flamingo.ai.studyrag.service.rag.embedding;

import com.flamingo.ai.studyrag.exception.ConfigException;
import java.time.Duration;

/**
 * Admission-control and retry settings for the hosted embedder.
 *
 * @param batchSize texts per remote call
 * @param maxConcurrentRequests in-flight remote calls allowed at once
 * @param maxWait how long a caller waits for a free slot
 * @param maxAttempts total attempts per call, including the first
 * @param initialBackoff wait before the first retry
 * @param backoffMultiplier growth factor of the wait between retries
 */
public record HostedEmbeddingSettings(
    int batchSize,
    int maxConcurrentRequests,
    Duration maxWait,
    int maxAttempts,
    Duration initialBackoff,
    double backoffMultiplier) {

  public HostedEmbeddingSettings {
    if (batchSize <= 0) {
      throw new ConfigException("rag.embedding.batch-size", "batch-size must be positive");
    }
    if (maxConcurrentRequests <= 0) {
      throw new ConfigException(
          "rag.embedding.max-concurrent-requests", "max-concurrent-requests must be positive");
    }
    if (maxAttempts <= 0) {
      throw new ConfigException("rag.embedding.max-attempts", "max-attempts must be positive");
    }
    if (initialBackoff.toMillis() < 1) {
      throw new ConfigException(
          "rag.embedding.initial-backoff-ms", "initial-backoff-ms must be at least 1");
    }
    if (backoffMultiplier < 1.0) {
      throw new ConfigException(
          "rag.embedding.backoff-multiplier", "backoff-multiplier must be at least 1.0");
    }
  }
}
