package com.flamingo.ai.studyrag.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the RAG pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Chunking chunking = new Chunking();
  private Embedding embedding = new Embedding();
  private Index index = new Index();
  private Retrieval retrieval = new Retrieval();
  private Generation generation = new Generation();

  @Getter
  @Setter
  public static class Chunking {
    /** {@code token} or {@code char}. */
    private String strategy = "token";

    private int size = 700;
    private int overlap = 100;
    private int charSize = 1200;
    private int charOverlap = 150;

    /** Drop repeated windows and windows of at most {@code minChunkChars} characters. */
    private boolean dedupe = false;

    private int minChunkChars = 10;
  }

  @Getter
  @Setter
  public static class Embedding {
    /** {@code hosted} or {@code hashing}. */
    private String strategy = "hashing";

    private int dimensions = 1536;
    private String modelName = "text-embedding-3-small";
    private int batchSize = 64;
    private int maxConcurrentRequests = 4;
    private long maxWaitMs = 30_000;
    private int timeoutSeconds = 30;
    private int maxAttempts = 4;
    private long initialBackoffMs = 500;
    private double backoffMultiplier = 2.0;
    private int hashingSeed = 7;
  }

  @Getter
  @Setter
  public static class Index {
    /** {@code local} or {@code elasticsearch}. */
    private String backend = "local";

    /** Journal file of the local engine; blank keeps the index in memory only. */
    private String storagePath = "";

    private String indexName = "study-rag-chunks";
    private int exportPageSize = 512;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int topK = 5;
    private int maxContextTokens = 1600;
  }

  @Getter
  @Setter
  public static class Generation {
    private boolean enabled = true;
    private String modelName = "gpt-4o-mini";
    private int maxCompletionTokens = 512;
    private int timeoutSeconds = 60;
  }
}
