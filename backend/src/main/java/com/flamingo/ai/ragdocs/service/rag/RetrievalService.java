package com.flamingo.ai.ragdocs.service.rag;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Incremental indexing of documentation and filtered semantic search over it. */
public interface RetrievalService {

  /**
   * Brings the index in line with the documentation files under {@code path}.
   *
   * <p>Only new, modified and deleted files touch the index. Calls for the same technology are
   * serialized.
   *
   * @param technology the technology the files belong to
   * @param path the documentation root
   * @return counts of processed files
   * @throws com.flamingo.ai.ragdocs.exception.StorageException if the cache or the store fails
   * @throws com.flamingo.ai.ragdocs.exception.SchemaException if the index cannot be created
   */
  SyncReport sync(String technology, Path path);

  /**
   * Searches chunks similar to {@code query}.
   *
   * @param query the query text
   * @param technologies technologies to search, empty for all
   * @param categories categories to search, empty for all
   * @param topK maximum results per technology
   * @return results grouped by technology, each group ordered by descending score
   */
  Map<String, List<SearchResult>> search(
      String query, Collection<String> technologies, Collection<String> categories, int topK);

  /** Technologies that completed at least one sync. */
  Set<String> getAvailableTechnologies();

  /** Category names known to the classifier, in tie-break order. */
  Set<String> getCategories();
}
