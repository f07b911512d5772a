package com.flamingo.ai.ragdocs.service.rag;

import com.flamingo.ai.ragdocs.elasticsearch.ChunkHit;
import com.flamingo.ai.ragdocs.elasticsearch.ChunkIndexOperations;
import com.flamingo.ai.ragdocs.elasticsearch.DocumentChunk;
import com.flamingo.ai.ragdocs.elasticsearch.SearchFilter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/** Exact-search chunk index for tests; distances are squared Euclidean like the real store. */
class InMemoryChunkIndex implements ChunkIndexOperations {

  private final List<DocumentChunk> chunks = new ArrayList<>();
  private final AtomicInteger nextId = new AtomicInteger();
  final AtomicInteger schemaCalls = new AtomicInteger();
  final AtomicInteger writeCalls = new AtomicInteger();

  @Override
  public void verifyConnection() {}

  @Override
  public void ensureSchema() {
    schemaCalls.incrementAndGet();
  }

  @Override
  public synchronized long deleteByFilePaths(Set<String> filePaths) {
    writeCalls.incrementAndGet();
    int before = chunks.size();
    chunks.removeIf(c -> filePaths.contains(c.getFilePath()));
    return before - chunks.size();
  }

  @Override
  public synchronized void insert(List<DocumentChunk> newChunks) {
    writeCalls.incrementAndGet();
    for (DocumentChunk chunk : newChunks) {
      chunks.add(
          DocumentChunk.builder()
              .id(String.valueOf(nextId.incrementAndGet()))
              .content(chunk.getContent())
              .technology(chunk.getTechnology())
              .filePath(chunk.getFilePath())
              .fileHash(chunk.getFileHash())
              .sectionTitle(chunk.getSectionTitle())
              .sectionLevel(chunk.getSectionLevel())
              .category(chunk.getCategory())
              .embedding(List.copyOf(chunk.getEmbedding()))
              .build());
    }
  }

  @Override
  public synchronized List<ChunkHit> search(
      List<Float> queryVector, SearchFilter filter, int limit) {
    return chunks.stream()
        .filter(c -> filter.matches(c.getTechnology(), c.getCategory()))
        .map(c -> new ChunkHit(c, squaredDistance(queryVector, c.getEmbedding())))
        .sorted(Comparator.comparingDouble(ChunkHit::distance))
        .limit(limit)
        .toList();
  }

  @Override
  public String getIndexName() {
    return "in-memory";
  }

  synchronized List<DocumentChunk> all() {
    return List.copyOf(chunks);
  }

  synchronized List<DocumentChunk> byFilePath(String filePath) {
    return chunks.stream().filter(c -> filePath.equals(c.getFilePath())).toList();
  }

  private static double squaredDistance(List<Float> a, List<Float> b) {
    double sum = 0;
    for (int i = 0; i < a.size(); i++) {
      double d = a.get(i) - b.get(i);
      sum += d * d;
    }
    return sum;
  }
}
