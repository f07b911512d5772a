package com.flamingo.ai.ragdocs.service.rag.embedding;

import com.flamingo.ai.ragdocs.config.RagConfig;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Maps text to fixed-dimension vectors through the configured LangChain4j {@link EmbeddingModel}.
 *
 * <p>Passages of a sync cycle are embedded in batches that run in parallel on the embedding
 * executor; output order always matches input order.
 */
@Service
@Slf4j
public class EmbeddingService {

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;
  private final Executor embeddingExecutor;
  private final int batchSize;
  private final int maxInputChars;

  public EmbeddingService(
      EmbeddingModel embeddingModel,
      MeterRegistry meterRegistry,
      @Qualifier("embeddingExecutor") Executor embeddingExecutor,
      RagConfig ragConfig) {
    this.embeddingModel = embeddingModel;
    this.meterRegistry = meterRegistry;
    this.embeddingExecutor = embeddingExecutor;
    this.batchSize = Math.max(1, ragConfig.getEmbedding().getBatchSize());
    this.maxInputChars = ragConfig.getEmbedding().getMaxInputChars();
  }

  /**
   * Embeds a search query.
   *
   * @param query the query text
   * @return embedding vector
   */
  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  @CircuitBreaker(name = "embedding")
  public List<Float> embedQuery(String query) {
    Response<Embedding> response = embeddingModel.embed(limit(query, "Query"));
    meterRegistry.counter("embedding.requests.success", "type", "query").increment();
    return toFloatList(response.content().vector());
  }

  /**
   * Embeds document passages in batches.
   *
   * @param passages the passages to embed
   * @return one vector per passage, in input order
   */
  @Timed(value = "embedding.embedBatch", description = "Time to embed batch")
  @CircuitBreaker(name = "embedding")
  public List<List<Float>> embedPassages(List<String> passages) {
    if (passages.isEmpty()) {
      return List.of();
    }

    List<CompletableFuture<List<List<Float>>>> batches = new ArrayList<>();
    for (int from = 0; from < passages.size(); from += batchSize) {
      List<String> batch = passages.subList(from, Math.min(from + batchSize, passages.size()));
      batches.add(CompletableFuture.supplyAsync(() -> embedBatch(batch), embeddingExecutor));
    }

    List<List<Float>> results = new ArrayList<>(passages.size());
    try {
      for (CompletableFuture<List<List<Float>>> batch : batches) {
        results.addAll(batch.join());
      }
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw e;
    }

    if (results.size() != passages.size()) {
      throw new IllegalStateException(
          String.format(
              "Embedding model returned %d vectors for %d passages",
              results.size(), passages.size()));
    }
    meterRegistry
        .counter("embedding.requests.success", "type", "passage")
        .increment(results.size());
    log.debug("Embedded {} passages in {} batches", passages.size(), batches.size());
    return results;
  }

  private List<List<Float>> embedBatch(List<String> batch) {
    List<TextSegment> segments = new ArrayList<>(batch.size());
    for (String passage : batch) {
      segments.add(TextSegment.from(limit(passage, "Passage")));
    }
    Response<List<Embedding>> response = embeddingModel.embedAll(segments);
    List<List<Float>> vectors = new ArrayList<>(segments.size());
    for (Embedding embedding : response.content()) {
      vectors.add(toFloatList(embedding.vector()));
    }
    return vectors;
  }

  private String limit(String text, String kind) {
    if (text.length() > maxInputChars) {
      log.warn(
          "{} too long for embedding, truncating from {} chars to {} chars",
          kind,
          text.length(),
          maxInputChars);
      return text.substring(0, maxInputChars);
    }
    return text;
  }

  /** Converts float array to Float list. */
  private List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }
}
