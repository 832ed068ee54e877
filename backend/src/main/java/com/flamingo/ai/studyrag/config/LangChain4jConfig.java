package com.flamingo.ai.studyrag.config;

import com.flamingo.ai.studyrag.agent.GroundedAnswerAgent;
import com.flamingo.ai.studyrag.exception.ConfigException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.service.AiServices;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for LangChain4j models. Each model is only created when the pipeline is configured
 * to use it, so the hashing embedder with generation disabled runs without an API key.
 */
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Bean
  @ConditionalOnProperty(prefix = "rag.embedding", name = "strategy", havingValue = "hosted")
  public EmbeddingModel embeddingModel(RagConfig ragConfig) {
    validateApiKey("rag.embedding.strategy");
    RagConfig.Embedding embedding = ragConfig.getEmbedding();

    return OpenAiEmbeddingModel.builder()
        .apiKey(openAiApiKey)
        .modelName(embedding.getModelName())
        .dimensions(embedding.getDimensions())
        .timeout(Duration.ofSeconds(embedding.getTimeoutSeconds()))
        .build();
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "rag.generation",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  public ChatModel chatModel(RagConfig ragConfig) {
    validateApiKey("rag.generation.enabled");
    RagConfig.Generation generation = ragConfig.getGeneration();

    return OpenAiChatModel.builder()
        .apiKey(openAiApiKey)
        .modelName(generation.getModelName())
        .maxCompletionTokens(generation.getMaxCompletionTokens())
        .timeout(Duration.ofSeconds(generation.getTimeoutSeconds()))
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  /** Grounded answer agent built with LangChain4j AI Services. */
  @Bean
  @ConditionalOnProperty(
      prefix = "rag.generation",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  public GroundedAnswerAgent groundedAnswerAgent(ChatModel chatModel) {
    return AiServices.builder(GroundedAnswerAgent.class).chatModel(chatModel).build();
  }

  private void validateApiKey(String setting) {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new ConfigException(
          setting, "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
