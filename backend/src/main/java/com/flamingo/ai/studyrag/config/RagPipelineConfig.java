package com.flamingo.ai.studyrag.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.studyrag.agent.GroundedAnswerAgent;
import com.flamingo.ai.studyrag.elasticsearch.ElasticsearchVectorIndex;
import com.flamingo.ai.studyrag.exception.ConfigException;
import com.flamingo.ai.studyrag.service.ingestion.DeckExportService;
import com.flamingo.ai.studyrag.service.ingestion.IngestionService;
import com.flamingo.ai.studyrag.service.query.RagQueryService;
import com.flamingo.ai.studyrag.service.rag.answer.AnswerGenerator;
import com.flamingo.ai.studyrag.service.rag.answer.AnswerService;
import com.flamingo.ai.studyrag.service.rag.answer.ExtractiveAnswerGenerator;
import com.flamingo.ai.studyrag.service.rag.answer.LlmAnswerGenerator;
import com.flamingo.ai.studyrag.service.rag.chunking.CharacterWindowChunker;
import com.flamingo.ai.studyrag.service.rag.chunking.ChunkUnit;
import com.flamingo.ai.studyrag.service.rag.chunking.ChunkingSettings;
import com.flamingo.ai.studyrag.service.rag.chunking.JtokkitTextTokenizer;
import com.flamingo.ai.studyrag.service.rag.chunking.TextChunker;
import com.flamingo.ai.studyrag.service.rag.chunking.TextTokenizer;
import com.flamingo.ai.studyrag.service.rag.chunking.TokenWindowChunker;
import com.flamingo.ai.studyrag.service.rag.embedding.Embedder;
import com.flamingo.ai.studyrag.service.rag.embedding.EmbeddingProfile;
import com.flamingo.ai.studyrag.service.rag.embedding.EmbeddingStrategy;
import com.flamingo.ai.studyrag.service.rag.embedding.HashingEmbedder;
import com.flamingo.ai.studyrag.service.rag.embedding.HostedEmbedder;
import com.flamingo.ai.studyrag.service.rag.embedding.HostedEmbeddingSettings;
import com.flamingo.ai.studyrag.service.rag.index.LocalVectorIndex;
import com.flamingo.ai.studyrag.service.rag.index.VectorIndex;
import com.flamingo.ai.studyrag.service.rag.retrieval.ContextPacker;
import com.flamingo.ai.studyrag.service.rag.retrieval.RetrievalSettings;
import com.flamingo.ai.studyrag.service.rag.retrieval.Retriever;
import dev.langchain4j.model.embedding.EmbeddingModel;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;

/**
 * Assembles the pipeline from {@link RagConfig}.
 *
 * <p>The mutable property binding is converted here, once, into validated immutable settings.
 * Strategy choices (chunk unit, embedder, index backend, answer generator) are resolved in these
 * factories; components never branch on configuration per call.
 */
@Configuration
@Slf4j
public class RagPipelineConfig {

  @Bean
  public ChunkingSettings chunkingSettings(RagConfig ragConfig) {
    RagConfig.Chunking chunking = ragConfig.getChunking();
    ChunkUnit unit = ChunkUnit.fromConfig(chunking.getStrategy());
    return unit == ChunkUnit.TOKEN
        ? new ChunkingSettings(
            unit,
            chunking.getSize(),
            chunking.getOverlap(),
            chunking.isDedupe(),
            chunking.getMinChunkChars())
        : new ChunkingSettings(
            unit,
            chunking.getCharSize(),
            chunking.getCharOverlap(),
            chunking.isDedupe(),
            chunking.getMinChunkChars());
  }

  @Bean
  public RetrievalSettings retrievalSettings(RagConfig ragConfig) {
    return new RetrievalSettings(
        ragConfig.getRetrieval().getTopK(), ragConfig.getRetrieval().getMaxContextTokens());
  }

  @Bean
  public TextTokenizer textTokenizer() {
    return new JtokkitTextTokenizer();
  }

  @Bean
  public TextChunker textChunker(ChunkingSettings settings, TextTokenizer tokenizer) {
    log.info(
        "Chunking by {} with window {} and overlap {}",
        settings.unit(),
        settings.size(),
        settings.overlap());
    return settings.unit() == ChunkUnit.TOKEN
        ? new TokenWindowChunker(settings, tokenizer)
        : new CharacterWindowChunker(settings);
  }

  @Bean
  public Embedder embedder(
      RagConfig ragConfig,
      ObjectProvider<EmbeddingModel> embeddingModel,
      MeterRegistry meterRegistry) {
    RagConfig.Embedding embedding = ragConfig.getEmbedding();
    EmbeddingStrategy strategy = EmbeddingStrategy.fromConfig(embedding.getStrategy());
    Embedder embedder =
        switch (strategy) {
          case HASHING ->
              new HashingEmbedder(embedding.getDimensions(), embedding.getHashingSeed());
          case HOSTED -> {
            EmbeddingModel model = embeddingModel.getIfAvailable();
            if (model == null) {
              throw new ConfigException(
                  "rag.embedding.strategy", "Hosted embedding requires an embedding model");
            }
            yield new HostedEmbedder(
                model,
                new EmbeddingProfile(strategy, embedding.getModelName(), embedding.getDimensions()),
                new HostedEmbeddingSettings(
                    embedding.getBatchSize(),
                    embedding.getMaxConcurrentRequests(),
                    Duration.ofMillis(embedding.getMaxWaitMs()),
                    embedding.getMaxAttempts(),
                    Duration.ofMillis(embedding.getInitialBackoffMs()),
                    embedding.getBackoffMultiplier()),
                meterRegistry);
          }
        };
    log.info("Embedding with profile {}", embedder.profile().describe());
    return embedder;
  }

  /** Creates the configured index backend and checks it against the embedder's profile. */
  @Bean
  public VectorIndex vectorIndex(
      RagConfig ragConfig,
      Embedder embedder,
      ObjectMapper objectMapper,
      ObjectProvider<ElasticsearchClient> elasticsearchClient,
      MeterRegistry meterRegistry) {
    RagConfig.Index index = ragConfig.getIndex();
    if (index.getExportPageSize() <= 0) {
      throw new ConfigException("rag.index.export-page-size", "export-page-size must be positive");
    }

    VectorIndex vectorIndex =
        switch (index.getBackend().trim().toLowerCase()) {
          case "local" -> {
            String storagePath = index.getStoragePath();
            yield new LocalVectorIndex(
                storagePath == null || storagePath.isBlank() ? null : Path.of(storagePath),
                objectMapper,
                index.getExportPageSize(),
                meterRegistry);
          }
          case "elasticsearch" -> {
            ElasticsearchClient client = elasticsearchClient.getIfAvailable();
            if (client == null) {
              throw new ConfigException(
                  "rag.index.backend", "Elasticsearch backend requires an Elasticsearch client");
            }
            yield new ElasticsearchVectorIndex(
                client, meterRegistry, index.getIndexName(), index.getExportPageSize());
          }
          default -> throw new ConfigException(
              "rag.index.backend", "Unknown index backend '" + index.getBackend() + "'");
        };

    vectorIndex.initialize(embedder.profile());
    return vectorIndex;
  }

  @Bean
  public ContextPacker contextPacker(TextTokenizer tokenizer) {
    return new ContextPacker(tokenizer);
  }

  @Bean
  public Retriever retriever(
      Embedder embedder, VectorIndex vectorIndex, MeterRegistry meterRegistry) {
    return new Retriever(embedder, vectorIndex, meterRegistry);
  }

  @Bean
  public ExtractiveAnswerGenerator extractiveAnswerGenerator() {
    return new ExtractiveAnswerGenerator();
  }

  @Bean
  public AnswerGenerator answerGenerator(
      RagConfig ragConfig,
      ObjectProvider<GroundedAnswerAgent> groundedAnswerAgent,
      ExtractiveAnswerGenerator extractiveAnswerGenerator) {
    if (!ragConfig.getGeneration().isEnabled()) {
      log.info("Generation disabled, answering extractively");
      return extractiveAnswerGenerator;
    }
    GroundedAnswerAgent agent = groundedAnswerAgent.getIfAvailable();
    if (agent == null) {
      throw new ConfigException(
          "rag.generation.enabled", "Generation is enabled but no chat model is configured");
    }
    return new LlmAnswerGenerator(agent);
  }

  @Bean
  public AnswerService answerService(
      @Qualifier("answerGenerator") AnswerGenerator answerGenerator,
      ExtractiveAnswerGenerator extractiveAnswerGenerator,
      MeterRegistry meterRegistry) {
    return new AnswerService(answerGenerator, extractiveAnswerGenerator, meterRegistry);
  }

  @Bean
  public IngestionService ingestionService(
      TextChunker textChunker,
      Embedder embedder,
      VectorIndex vectorIndex,
      @Qualifier("ingestionExecutor") Executor ingestionExecutor,
      MeterRegistry meterRegistry) {
    return new IngestionService(
        textChunker, embedder, vectorIndex, ingestionExecutor, meterRegistry);
  }

  @Bean
  public RagQueryService ragQueryService(
      Retriever retriever,
      ContextPacker contextPacker,
      AnswerService answerService,
      RetrievalSettings retrievalSettings,
      @Qualifier("queryExecutor") AsyncTaskExecutor queryExecutor) {
    return new RagQueryService(
        retriever, contextPacker, answerService, retrievalSettings, queryExecutor);
  }

  @Bean
  public DeckExportService deckExportService(VectorIndex vectorIndex, ObjectMapper objectMapper) {
    return new DeckExportService(vectorIndex, objectMapper);
  }
}
