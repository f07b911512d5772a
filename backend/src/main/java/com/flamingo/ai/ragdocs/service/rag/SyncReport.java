package com.flamingo.ai.ragdocs.service.rag;

import java.util.List;

/**
 * Outcome of syncing one technology.
 *
 * @param technology the synced technology
 * @param newFiles number of files indexed for the first time
 * @param modifiedFiles number of files re-indexed
 * @param deletedFiles number of files whose chunks were removed
 * @param chunksIndexed number of chunks inserted
 * @param failedFiles files that could not be read or segmented; they are retried on the next sync
 * @param skippedFiles files the change detection could not read
 */
public record SyncReport(
    String technology,
    int newFiles,
    int modifiedFiles,
    int deletedFiles,
    int chunksIndexed,
    List<String> failedFiles,
    List<String> skippedFiles) {

  public SyncReport {
    failedFiles = List.copyOf(failedFiles);
    skippedFiles = List.copyOf(skippedFiles);
  }

  static SyncReport unchanged(String technology, List<String> skippedFiles) {
    return new SyncReport(technology, 0, 0, 0, 0, List.of(), skippedFiles);
  }

  public boolean hasChanges() {
    return newFiles + modifiedFiles + deletedFiles > 0;
  }
}
