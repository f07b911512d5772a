package com.flamingo.ai.ragdocs.elasticsearch;

import java.util.List;
import java.util.Set;

/** Operations on the vector index that holds documentation chunks. */
public interface ChunkIndexOperations {

  /**
   * Fails with a connection error if the store cannot be reached.
   *
   * <p>Called once before the startup sync.
   */
  void verifyConnection();

  /**
   * Creates the index with its mapping if it does not exist, otherwise validates the existing
   * mapping. Only the first successful call reaches the store.
   */
  void ensureSchema();

  /**
   * Deletes every chunk whose file path is in {@code filePaths}. The delete is visible to
   * searches when this method returns.
   *
   * @param filePaths source file paths
   * @return number of chunks deleted
   */
  long deleteByFilePaths(Set<String> filePaths);

  /**
   * Inserts all chunks in one batch and flushes so that subsequent searches see them.
   *
   * @param chunks chunks with embeddings; ids are assigned by the store
   */
  void insert(List<DocumentChunk> chunks);

  /**
   * Approximate nearest-neighbour search.
   *
   * @param queryVector the query embedding
   * @param filter metadata filter, possibly empty
   * @param limit maximum number of hits
   * @return hits ordered by ascending distance
   */
  List<ChunkHit> search(List<Float> queryVector, SearchFilter filter, int limit);

  String getIndexName();
}
