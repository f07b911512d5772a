package com.flamingo.ai.ragdocs.service.tracking;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.flamingo.ai.ragdocs.config.RagConfig;
import com.flamingo.ai.ragdocs.exception.DocumentParseException;
import com.flamingo.ai.ragdocs.exception.StorageException;
import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Durable store for file fingerprints: a JSON object keyed by file path.
 *
 * <p>Loading never fails. A missing or unparseable file yields an empty map and a corrupted entry
 * is dropped on its own. Saving replaces the file atomically where the filesystem allows it.
 */
@Component
@Slf4j
public class FingerprintCache {

  private final Path cacheFile;
  private final ObjectMapper objectMapper;

  @Autowired
  public FingerprintCache(RagConfig ragConfig) {
    this(Path.of(ragConfig.getTracking().getCacheFile()));
  }

  @VisibleForTesting
  public FingerprintCache(Path cacheFile) {
    this.cacheFile = cacheFile;
    this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
  }

  /**
   * Reads all fingerprints from disk.
   *
   * @return mutable map of path to fingerprint, empty when the cache is absent or unreadable
   */
  public Map<String, FileFingerprint> load() {
    Map<String, FileFingerprint> fingerprints = new LinkedHashMap<>();
    if (!Files.exists(cacheFile)) {
      log.info("No fingerprint cache at {}, starting empty", cacheFile);
      return fingerprints;
    }

    JsonNode root;
    try {
      root = objectMapper.readTree(cacheFile.toFile());
    } catch (IOException e) {
      log.warn("Fingerprint cache {} is malformed, starting empty: {}", cacheFile, e.getMessage());
      return fingerprints;
    }

    if (root == null || !root.isObject()) {
      log.warn("Fingerprint cache {} is not a JSON object, starting empty", cacheFile);
      return fingerprints;
    }

    Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      try {
        fingerprints.put(field.getKey(), readEntry(field.getKey(), field.getValue()));
      } catch (DocumentParseException e) {
        log.warn("Dropping corrupted fingerprint entry '{}': {}", field.getKey(), e.getMessage());
      }
    }
    log.info("Loaded {} fingerprints from {}", fingerprints.size(), cacheFile);
    return fingerprints;
  }

  /**
   * Writes the given fingerprints, replacing the previous cache.
   *
   * @throws StorageException if the cache cannot be written
   */
  public void save(Map<String, FileFingerprint> fingerprints) {
    Path tmp = cacheFile.resolveSibling(cacheFile.getFileName() + ".tmp");
    try {
      Path parent = cacheFile.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      objectMapper.writeValue(tmp.toFile(), new TreeMap<>(fingerprints));
      try {
        Files.move(
            tmp, cacheFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, cacheFile, StandardCopyOption.REPLACE_EXISTING);
      }
      log.debug("Saved {} fingerprints to {}", fingerprints.size(), cacheFile);
    } catch (IOException e) {
      log.error("Failed to write fingerprint cache {}: {}", cacheFile, e.getMessage(), e);
      throw new StorageException("Failed to write fingerprint cache " + cacheFile, e);
    }
  }

  private FileFingerprint readEntry(String key, JsonNode node) {
    if (node == null || !node.isObject()) {
      throw new DocumentParseException("entry is not an object");
    }
    FileFingerprint fingerprint;
    try {
      fingerprint = objectMapper.treeToValue(node, FileFingerprint.class);
    } catch (JsonProcessingException e) {
      throw new DocumentParseException(e.getOriginalMessage(), e);
    }
    if (fingerprint.getFilePath() == null) {
      fingerprint.setFilePath(key);
    }
    if (!fingerprint.isComplete()) {
      throw new DocumentParseException("missing hash or technology");
    }
    return fingerprint;
  }
}
