package com.flamingo.ai.studyrag.service.rag.embedding;

import com.flamingo.ai.studyrag.exception.ConfigException;
import com.flamingo.ai.studyrag.exception.EmbeddingUnavailableException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link Embedder} that calls a remote embedding model through LangChain4j.
 *
 * <p>Every remote call goes through a semaphore {@link Bulkhead} that bounds in-flight requests,
 * and a {@link Retry} with exponential backoff for transient failures (network errors, timeouts,
 * rate limits). Malformed input and dimension mismatches are not retried.
 */
@Slf4j
public class HostedEmbedder implements Embedder {

  // text-embedding-3 models accept 8192 tokens; stay well below for dense scripts
  private static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private final EmbeddingModel embeddingModel;
  private final EmbeddingProfile profile;
  private final HostedEmbeddingSettings settings;
  private final MeterRegistry meterRegistry;
  private final Bulkhead bulkhead;
  private final Retry retry;

  public HostedEmbedder(
      EmbeddingModel embeddingModel,
      EmbeddingProfile profile,
      HostedEmbeddingSettings settings,
      MeterRegistry meterRegistry) {
    this.embeddingModel = embeddingModel;
    this.profile = profile;
    this.settings = settings;
    this.meterRegistry = meterRegistry;
    this.bulkhead =
        Bulkhead.of(
            "embedding",
            BulkheadConfig.custom()
                .maxConcurrentCalls(settings.maxConcurrentRequests())
                .maxWaitDuration(settings.maxWait())
                .build());
    this.retry =
        Retry.of(
            "embedding",
            RetryConfig.custom()
                .maxAttempts(settings.maxAttempts())
                .intervalFunction(
                    IntervalFunction.ofExponentialBackoff(
                        settings.initialBackoff(), settings.backoffMultiplier()))
                .retryOnException(HostedEmbedder::isTransient)
                .build());
  }

  @Override
  public EmbeddingProfile profile() {
    return profile;
  }

  @Override
  public float[] embed(String text) {
    float[] vector = call(List.of(text), "single").get(0);
    meterRegistry.counter("embedding.requests.success", "type", "single").increment();
    return vector;
  }

  @Override
  public List<float[]> embedBatch(List<String> texts) {
    List<float[]> vectors = new ArrayList<>(texts.size());
    for (int from = 0; from < texts.size(); from += settings.batchSize()) {
      int to = Math.min(from + settings.batchSize(), texts.size());
      vectors.addAll(call(texts.subList(from, to), "batch"));
      meterRegistry.counter("embedding.requests.success", "type", "batch").increment();
    }
    return vectors;
  }

  private List<float[]> call(List<String> texts, String type) {
    Supplier<List<float[]>> remote =
        Bulkhead.decorateSupplier(bulkhead, () -> embedRemote(texts));
    try {
      return Retry.decorateSupplier(retry, remote).get();
    } catch (ConfigException | IllegalArgumentException e) {
      throw e;
    } catch (RuntimeException e) {
      meterRegistry.counter("embedding.requests.failure", "type", type).increment();
      if (Thread.currentThread().isInterrupted()) {
        CancellationException cancelled = new CancellationException("Embedding call interrupted");
        cancelled.initCause(e);
        throw cancelled;
      }
      log.warn(
          "Embedding of {} text(s) failed after {} attempt(s): {}",
          texts.size(),
          settings.maxAttempts(),
          e.getMessage());
      throw new EmbeddingUnavailableException(
          "Embedding service unavailable: " + e.getMessage(), settings.maxAttempts(), e);
    }
  }

  private List<float[]> embedRemote(List<String> texts) {
    List<TextSegment> segments = new ArrayList<>(texts.size());
    for (String text : texts) {
      if (text == null || text.isBlank()) {
        throw new IllegalArgumentException("Cannot embed blank text");
      }
      String input = text;
      if (input.length() > MAX_CHARS_PER_EMBEDDING) {
        log.warn(
            "Text too long for embedding, truncating from {} chars to {} chars",
            input.length(),
            MAX_CHARS_PER_EMBEDDING);
        input = input.substring(0, MAX_CHARS_PER_EMBEDDING);
      }
      segments.add(TextSegment.from(input));
    }

    log.debug("Calling embedding model for {} segment(s)", segments.size());
    Response<List<Embedding>> response = embeddingModel.embedAll(segments);
    List<Embedding> embeddings = response.content();
    if (embeddings == null || embeddings.size() != segments.size()) {
      throw new IllegalStateException(
          String.format(
              "Embedding service returned %d vectors for %d inputs",
              embeddings == null ? 0 : embeddings.size(), segments.size()));
    }

    List<float[]> vectors = new ArrayList<>(embeddings.size());
    for (Embedding embedding : embeddings) {
      float[] vector = embedding.vector();
      if (vector.length != profile.dimensions()) {
        throw new ConfigException(
            "rag.embedding.dimensions",
            String.format(
                "Embedding model '%s' returned %d dimensions but %d are configured",
                profile.model(), vector.length, profile.dimensions()));
      }
      vectors.add(vector);
    }
    return vectors;
  }

  static boolean isTransient(Throwable t) {
    if (Thread.currentThread().isInterrupted()) {
      return false;
    }
    return !(t instanceof ConfigException || t instanceof IllegalArgumentException);
  }
}
