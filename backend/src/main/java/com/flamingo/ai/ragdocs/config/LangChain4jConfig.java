package com.flamingo.ai.ragdocs.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the LangChain4j embedding model.
 *
 * <p>The default provider runs all-MiniLM-L6-v2 in-process (384 dimensions). Setting {@code
 * rag.embedding.provider=openai} switches to the OpenAI embedding API; {@code
 * rag.index.vector-dimensions} must then match the requested dimensions.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class LangChain4jConfig {

  private final RagConfig ragConfig;

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  @Bean
  public EmbeddingModel embeddingModel() {
    String provider = ragConfig.getEmbedding().getProvider();
    if ("openai".equalsIgnoreCase(provider)) {
      validateApiKey();
      log.info(
          "Using OpenAI embedding model {} ({} dimensions)",
          embeddingModelName,
          ragConfig.getIndex().getVectorDimensions());
      return OpenAiEmbeddingModel.builder()
          .apiKey(openAiApiKey)
          .modelName(embeddingModelName)
          .dimensions(ragConfig.getIndex().getVectorDimensions())
          .timeout(Duration.ofSeconds(30))
          .build();
    }
    if (!"local".equalsIgnoreCase(provider)) {
      throw new IllegalStateException("Unknown embedding provider: " + provider);
    }
    log.info("Using local all-MiniLM-L6-v2 embedding model");
    return new AllMiniLmL6V2EmbeddingModel();
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
