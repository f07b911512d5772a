package com.flamingo.ai.ragdocs.service.rag;

import com.flamingo.ai.ragdocs.elasticsearch.ChunkHit;
import com.flamingo.ai.ragdocs.elasticsearch.ChunkIndexOperations;
import com.flamingo.ai.ragdocs.elasticsearch.DocumentChunk;
import com.flamingo.ai.ragdocs.elasticsearch.SearchFilter;
import com.flamingo.ai.ragdocs.exception.DocumentProcessingException;
import com.flamingo.ai.ragdocs.exception.SearchException;
import com.flamingo.ai.ragdocs.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.ragdocs.service.rag.segmentation.CategoryClassifier;
import com.flamingo.ai.ragdocs.service.rag.segmentation.MarkdownSegmenter;
import com.flamingo.ai.ragdocs.service.rag.segmentation.SectionCandidate;
import com.flamingo.ai.ragdocs.service.tracking.ChangeSet;
import com.flamingo.ai.ragdocs.service.tracking.ChangeTracker;
import com.flamingo.ai.ragdocs.service.tracking.FileFingerprint;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Orchestrates change detection, segmentation, embedding and the chunk index.
 *
 * <p>A file update is delete-then-insert: every chunk of a changed path is purged before the new
 * chunks go in, so no chunk of an earlier version survives. Embedding happens before the purge, so
 * an embedding failure leaves the index untouched.
 */
@Service
@Slf4j
public class RetrievalServiceImpl implements RetrievalService {

  private final ChangeTracker changeTracker;
  private final MarkdownSegmenter markdownSegmenter;
  private final CategoryClassifier categoryClassifier;
  private final EmbeddingService embeddingService;
  private final ChunkIndexOperations chunkIndex;
  private final ScoreNormalizer scoreNormalizer;
  private final MeterRegistry meterRegistry;

  private final Map<String, ReentrantLock> syncLocks = new ConcurrentHashMap<>();
  private final Set<String> availableTechnologies =
      Collections.synchronizedSet(new LinkedHashSet<>());

  // Paths of deleted files whose chunks could not be purged yet, per technology
  private final Map<String, Set<String>> pendingPurges = new ConcurrentHashMap<>();

  public RetrievalServiceImpl(
      ChangeTracker changeTracker,
      MarkdownSegmenter markdownSegmenter,
      CategoryClassifier categoryClassifier,
      EmbeddingService embeddingService,
      ChunkIndexOperations chunkIndex,
      ScoreNormalizer scoreNormalizer,
      MeterRegistry meterRegistry) {
    this.changeTracker = changeTracker;
    this.markdownSegmenter = markdownSegmenter;
    this.categoryClassifier = categoryClassifier;
    this.embeddingService = embeddingService;
    this.chunkIndex = chunkIndex;
    this.scoreNormalizer = scoreNormalizer;
    this.meterRegistry = meterRegistry;
  }

  @Override
  @Timed(value = "rag.sync", description = "Time to sync a technology")
  public SyncReport sync(String technology, Path path) {
    if (technology == null || technology.isBlank()) {
      throw new IllegalArgumentException("Technology must not be blank");
    }
    if (path == null) {
      throw new IllegalArgumentException("Documentation path must not be null");
    }
    ReentrantLock lock = syncLocks.computeIfAbsent(technology, t -> new ReentrantLock());
    lock.lock();
    try {
      return doSync(technology, path);
    } finally {
      lock.unlock();
    }
  }

  private SyncReport doSync(String technology, Path path) {
    log.info("Syncing {} from {}", technology, path);
    ChangeSet changes = changeTracker.diff(path, technology);
    Set<String> pending = pendingPurges.getOrDefault(technology, Set.of());

    if (changes.isEmpty() && pending.isEmpty()) {
      availableTechnologies.add(technology);
      log.info("No changes for {}", technology);
      return SyncReport.unchanged(technology, changes.skippedFiles());
    }

    try {
      chunkIndex.ensureSchema();

      List<String> failedFiles = new ArrayList<>();
      List<DocumentChunk> chunks = new ArrayList<>();
      for (String file : changes.filesToIndex()) {
        try {
          chunks.addAll(segment(technology, file));
        } catch (DocumentProcessingException e) {
          log.warn("Skipping {}: {}", e.getFilePath(), e.getMessage());
          failedFiles.add(file);
        }
      }

      embed(chunks);

      Set<String> purge = new LinkedHashSet<>(changes.filesToPurge());
      purge.addAll(pending);
      chunkIndex.deleteByFilePaths(purge);
      pendingPurges.remove(technology);
      chunkIndex.insert(chunks);

      // Failed files have no chunks left; forgetting them makes the next sync retry them
      changeTracker.forget(failedFiles);
      availableTechnologies.add(technology);

      SyncReport report =
          new SyncReport(
              technology,
              changes.newFiles().size(),
              changes.modifiedFiles().size(),
              changes.deletedFiles().size(),
              chunks.size(),
              failedFiles,
              changes.skippedFiles());
      record(report);
      log.info(
          "Synced {}: {} new, {} modified, {} deleted, {} chunks, {} failed",
          technology,
          report.newFiles(),
          report.modifiedFiles(),
          report.deletedFiles(),
          report.chunksIndexed(),
          failedFiles.size());
      return report;
    } catch (RuntimeException e) {
      // The diff already advanced the fingerprints; undo that so the next sync redoes the work
      changeTracker.forget(changes.filesToIndex());
      if (!changes.deletedFiles().isEmpty()) {
        pendingPurges
            .computeIfAbsent(technology, t -> ConcurrentHashMap.newKeySet())
            .addAll(changes.deletedFiles());
      }
      meterRegistry.counter("rag.sync.failures", "technology", technology).increment();
      log.error("Sync of {} failed: {}", technology, e.getMessage());
      throw e;
    }
  }

  private List<DocumentChunk> segment(String technology, String file) {
    String text;
    try {
      text = Files.readString(Path.of(file), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new DocumentProcessingException(file, "Failed to read file: " + e.getMessage(), e);
    }

    List<SectionCandidate> sections;
    try {
      sections = markdownSegmenter.process(text).sections();
    } catch (RuntimeException e) {
      throw new DocumentProcessingException(file, "Failed to segment file: " + e.getMessage(), e);
    }

    String fileHash = changeTracker.fingerprint(file).map(FileFingerprint::getHash).orElse(null);
    List<DocumentChunk> chunks = new ArrayList<>(sections.size());
    for (SectionCandidate section : sections) {
      chunks.add(
          DocumentChunk.builder()
              .content(section.content())
              .technology(technology)
              .filePath(file)
              .fileHash(fileHash)
              .sectionTitle(section.title())
              .sectionLevel(section.level())
              .category(markdownSegmenter.classify(section.content(), section.title()))
              .build());
    }
    log.debug("Segmented {} into {} chunks", file, chunks.size());
    return chunks;
  }

  private void embed(List<DocumentChunk> chunks) {
    if (chunks.isEmpty()) {
      return;
    }
    List<List<Float>> vectors =
        embeddingService.embedPassages(chunks.stream().map(DocumentChunk::getContent).toList());
    for (int i = 0; i < chunks.size(); i++) {
      chunks.get(i).setEmbedding(vectors.get(i));
    }
  }

  private void record(SyncReport report) {
    String technology = report.technology();
    meterRegistry
        .counter("rag.sync.files", "technology", technology, "change", "new")
        .increment(report.newFiles());
    meterRegistry
        .counter("rag.sync.files", "technology", technology, "change", "modified")
        .increment(report.modifiedFiles());
    meterRegistry
        .counter("rag.sync.files", "technology", technology, "change", "deleted")
        .increment(report.deletedFiles());
  }

  @Override
  @Timed(value = "rag.search", description = "Time for filtered vector search")
  public Map<String, List<SearchResult>> search(
      String query, Collection<String> technologies, Collection<String> categories, int topK) {
    if (query == null || query.isBlank()) {
      throw new SearchException("Query must not be blank", "Please enter a search query.");
    }
    if (topK <= 0) {
      throw new SearchException(
          "topK must be positive but was " + topK, "The number of results must be positive.");
    }

    SearchFilter filter = SearchFilter.of(technologies, categories);
    int groups =
        filter.technologies().isEmpty()
            ? Math.max(1, knownTechnologies().size())
            : filter.technologies().size();
    int limit = topK * groups;

    List<Float> queryVector = embeddingService.embedQuery(query);
    List<ChunkHit> hits = chunkIndex.search(queryVector, filter, limit);

    Map<String, List<SearchResult>> grouped = new LinkedHashMap<>();
    for (ChunkHit hit : hits) {
      DocumentChunk chunk = hit.chunk();
      List<SearchResult> group =
          grouped.computeIfAbsent(chunk.getTechnology(), t -> new ArrayList<>());
      if (group.size() < topK) {
        group.add(toResult(chunk, scoreNormalizer.normalize(hit.distance())));
      }
    }
    log.debug(
        "Search '{}' filter={} returned {} hits in {} groups",
        query,
        filter.toExpression().orElse("<none>"),
        hits.size(),
        grouped.size());
    return grouped;
  }

  private static SearchResult toResult(DocumentChunk chunk, double score) {
    return new SearchResult(
        chunk.getContent(),
        chunk.getTechnology(),
        chunk.getFilePath(),
        chunk.getSectionTitle(),
        chunk.getSectionLevel(),
        chunk.getCategory(),
        score);
  }

  // Technologies indexed by an earlier run are only known through the fingerprint cache
  private Set<String> knownTechnologies() {
    Set<String> known = new HashSet<>(getAvailableTechnologies());
    known.addAll(changeTracker.trackedTechnologies());
    return known;
  }

  @Override
  public Set<String> getAvailableTechnologies() {
    synchronized (availableTechnologies) {
      return Collections.unmodifiableSet(new LinkedHashSet<>(availableTechnologies));
    }
  }

  @Override
  public Set<String> getCategories() {
    return categoryClassifier.categories();
  }
}
