package com.flamingo.ai.docqa.config;

import com.flamingo.ai.docqa.service.rag.embedding.EmbeddingProvider;
import com.flamingo.ai.docqa.service.rag.embedding.HashEmbeddingProvider;
import com.flamingo.ai.docqa.service.rag.embedding.LangChain4jEmbeddingProvider;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;

/**
 * Configuration for LangChain4j models and the embedding provider chain.
 *
 * <p>Provider beans are ordered: the primary OpenAI model, an optional secondary model, then the
 * local hash fallback.
 */
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-4o-mini}")
  private String chatModelName;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  @Bean
  public ChatModel chatModel(RagConfig ragConfig) {
    validateApiKey();

    // model name, temperature and token limit are set per request
    return OpenAiChatModel.builder()
        .apiKey(openAiApiKey)
        .modelName(chatModelName)
        .timeout(Duration.ofSeconds(ragConfig.getGeneration().getTimeoutSeconds()))
        .maxRetries(0)
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  @Bean
  public EmbeddingModel embeddingModel(RagConfig ragConfig) {
    validateApiKey();

    return OpenAiEmbeddingModel.builder()
        .apiKey(openAiApiKey)
        .modelName(embeddingModelName)
        .dimensions(ragConfig.getEmbedding().getDimensions())
        .timeout(Duration.ofSeconds(30))
        .maxRetries(0)
        .build();
  }

  @Bean
  @Order(1)
  public EmbeddingProvider primaryEmbeddingProvider(
      EmbeddingModel embeddingModel, RagConfig ragConfig) {
    return new LangChain4jEmbeddingProvider(
        embeddingModelName, ragConfig.getEmbedding().getDimensions(), embeddingModel);
  }

  @Bean
  @Order(2)
  @ConditionalOnProperty(prefix = "rag.embedding", name = "secondary-model-name")
  public EmbeddingProvider secondaryEmbeddingProvider(RagConfig ragConfig) {
    validateApiKey();

    String modelName = ragConfig.getEmbedding().getSecondaryModelName();
    int dimensions = ragConfig.getEmbedding().getDimensions();
    EmbeddingModel model =
        OpenAiEmbeddingModel.builder()
            .apiKey(openAiApiKey)
            .modelName(modelName)
            .dimensions(dimensions)
            .timeout(Duration.ofSeconds(30))
            .maxRetries(0)
            .build();
    return new LangChain4jEmbeddingProvider(modelName, dimensions, model);
  }

  @Bean
  @Order(Ordered.LOWEST_PRECEDENCE)
  @ConditionalOnProperty(
      prefix = "rag.embedding",
      name = "hash-fallback-enabled",
      havingValue = "true",
      matchIfMissing = true)
  public EmbeddingProvider hashEmbeddingProvider(RagConfig ragConfig) {
    return new HashEmbeddingProvider(ragConfig.getEmbedding().getDimensions());
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
