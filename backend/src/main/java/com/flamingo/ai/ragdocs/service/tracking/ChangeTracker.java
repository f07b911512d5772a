package com.flamingo.ai.ragdocs.service.tracking;

import com.flamingo.ai.ragdocs.config.RagConfig;
import io.micrometer.core.annotation.Timed;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Decides which documentation files need re-indexing by comparing the filesystem against stored
 * fingerprints.
 *
 * <p>Fingerprints are loaded once when the tracker is created and saved at the end of every
 * {@link #diff} call, so the in-memory and on-disk sets never drift apart between calls. A file
 * that cannot be read is reported in {@link ChangeSet#skippedFiles()} and left alone; it never
 * aborts the pass.
 */
@Service
@Slf4j
public class ChangeTracker {

  private final FingerprintCache cache;
  private final ContentHasher hasher;
  private final String extension;
  private final Clock clock;
  private final Map<String, FileFingerprint> fingerprints;
  private final Object saveLock = new Object();

  @Autowired
  public ChangeTracker(FingerprintCache cache, ContentHasher hasher, RagConfig ragConfig) {
    this(cache, hasher, ragConfig.getTracking().getExtension(), Clock.systemUTC());
  }

  public ChangeTracker(
      FingerprintCache cache, ContentHasher hasher, String extension, Clock clock) {
    this.cache = cache;
    this.hasher = hasher;
    this.extension = extension;
    this.clock = clock;
    this.fingerprints = new ConcurrentHashMap<>(cache.load());
  }

  /**
   * Walks {@code root} and classifies every document file for {@code technology}.
   *
   * <p>New files get a fingerprint, modified files have theirs updated in place and deleted files
   * lose theirs. The cache is saved before returning, also when only deletions were found.
   *
   * @param root the documentation directory of the technology
   * @param technology the technology the files belong to
   * @return the classified paths
   * @throws com.flamingo.ai.ragdocs.exception.StorageException if the cache cannot be saved
   */
  @Timed(value = "rag.tracking.diff", description = "Time to detect documentation changes")
  public ChangeSet diff(Path root, String technology) {
    Path normalizedRoot = root.toAbsolutePath().normalize();
    WalkResult walk = walk(normalizedRoot);

    List<String> newFiles = new ArrayList<>();
    List<String> modifiedFiles = new ArrayList<>();
    List<String> skippedFiles = new ArrayList<>(walk.unreadable());
    Set<String> observed = new HashSet<>(walk.unreadable());

    for (Path file : walk.files()) {
      String key = file.toString();
      observed.add(key);

      String hash;
      long lastModified;
      try {
        hash = hasher.hash(file);
        lastModified = Files.getLastModifiedTime(file).toMillis();
      } catch (IOException e) {
        log.warn("Skipping unreadable file {}: {}", key, e.getMessage());
        skippedFiles.add(key);
        continue;
      }

      FileFingerprint existing = fingerprints.get(key);
      if (existing == null) {
        fingerprints.put(
            key,
            FileFingerprint.builder()
                .filePath(key)
                .hash(hash)
                .lastModified(lastModified)
                .technology(technology)
                .lastIndexed(clock.millis())
                .build());
        newFiles.add(key);
      } else if (!existing.getHash().equals(hash) || existing.getLastModified() < lastModified) {
        existing.setHash(hash);
        existing.setLastModified(lastModified);
        existing.setLastIndexed(clock.millis());
        modifiedFiles.add(key);
      }
    }

    List<String> deletedFiles = new ArrayList<>();
    for (FileFingerprint fingerprint : List.copyOf(fingerprints.values())) {
      String path = fingerprint.getFilePath();
      if (technology.equals(fingerprint.getTechnology())
          && !observed.contains(path)
          && !isUnder(path, walk.unreadableDirectories())) {
        deletedFiles.add(path);
        fingerprints.remove(path);
      }
    }

    save();

    ChangeSet changes = new ChangeSet(newFiles, modifiedFiles, deletedFiles, skippedFiles);
    log.info(
        "Change detection for {} in {}: {} new, {} modified, {} deleted, {} skipped",
        technology,
        normalizedRoot,
        newFiles.size(),
        modifiedFiles.size(),
        deletedFiles.size(),
        skippedFiles.size());
    return changes;
  }

  /**
   * Drops the fingerprints of the given paths so the next {@link #diff} reports them as new.
   * Used when indexing of already-classified files did not complete.
   */
  public void forget(Collection<String> paths) {
    if (paths.isEmpty()) {
      return;
    }
    paths.forEach(fingerprints::remove);
    save();
    log.info("Forgot {} fingerprints; they will be re-indexed on the next sync", paths.size());
  }

  public Optional<FileFingerprint> fingerprint(String path) {
    return Optional.ofNullable(fingerprints.get(path));
  }

  /** Technologies that have at least one tracked file, including ones loaded from the cache. */
  public Set<String> trackedTechnologies() {
    Set<String> technologies = new HashSet<>();
    for (FileFingerprint fingerprint : fingerprints.values()) {
      technologies.add(fingerprint.getTechnology());
    }
    return technologies;
  }

  /** Number of files currently tracked for a technology. */
  public long trackedFileCount(String technology) {
    return fingerprints.values().stream()
        .filter(f -> technology.equals(f.getTechnology()))
        .count();
  }

  private void save() {
    synchronized (saveLock) {
      cache.save(Map.copyOf(fingerprints));
    }
  }

  private WalkResult walk(Path root) {
    List<Path> files = new ArrayList<>();
    List<String> unreadable = new ArrayList<>();
    List<Path> unreadableDirectories = new ArrayList<>();

    if (!Files.isDirectory(root)) {
      log.warn("Documentation root {} does not exist or is not a directory", root);
      return new WalkResult(files, unreadable, unreadableDirectories);
    }

    try {
      Files.walkFileTree(
          root,
          new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
              if (attrs.isRegularFile() && isDocument(file)) {
                files.add(file);
              }
              return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
              if (Files.isDirectory(file)) {
                log.warn("Skipping unreadable directory {}: {}", file, exc.getMessage());
                unreadableDirectories.add(file);
              } else if (isDocument(file)) {
                log.warn("Skipping unreadable file {}: {}", file, exc.getMessage());
                unreadable.add(file.toString());
              }
              return FileVisitResult.CONTINUE;
            }
          });
    } catch (IOException e) {
      // walkFileTree only rethrows what the visitor returns; the visitor never fails
      log.warn("Walk of {} ended early: {}", root, e.getMessage());
      unreadableDirectories.add(root);
    }
    return new WalkResult(files, unreadable, unreadableDirectories);
  }

  private boolean isDocument(Path file) {
    Path name = file.getFileName();
    return name != null && name.toString().endsWith(extension);
  }

  private static boolean isUnder(String path, List<Path> directories) {
    if (directories.isEmpty()) {
      return false;
    }
    Path candidate = Path.of(path);
    return directories.stream().anyMatch(candidate::startsWith);
  }

  private record WalkResult(
      List<Path> files, List<String> unreadable, List<Path> unreadableDirectories) {}
}
