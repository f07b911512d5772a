package com.flamingo.ai.ragdocs.service.tracking;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of one change-detection pass over a technology's documentation root.
 *
 * @param newFiles paths seen for the first time
 * @param modifiedFiles paths whose hash changed or whose modification time moved forward
 * @param deletedFiles previously tracked paths of the technology that no longer exist
 * @param skippedFiles candidate paths that could not be read this pass; they are neither
 *     classified nor treated as deleted
 */
public record ChangeSet(
    List<String> newFiles,
    List<String> modifiedFiles,
    List<String> deletedFiles,
    List<String> skippedFiles) {

  public ChangeSet {
    newFiles = List.copyOf(newFiles);
    modifiedFiles = List.copyOf(modifiedFiles);
    deletedFiles = List.copyOf(deletedFiles);
    skippedFiles = List.copyOf(skippedFiles);
  }

  /** True when nothing needs to change in the index. Skipped files do not count. */
  public boolean isEmpty() {
    return newFiles.isEmpty() && modifiedFiles.isEmpty() && deletedFiles.isEmpty();
  }

  /** Files that must be segmented, embedded and inserted. */
  public List<String> filesToIndex() {
    List<String> files = new ArrayList<>(newFiles);
    files.addAll(modifiedFiles);
    return files;
  }

  /** Files whose existing chunks must be removed before the insert. */
  public Set<String> filesToPurge() {
    Set<String> files = new LinkedHashSet<>(newFiles);
    files.addAll(modifiedFiles);
    files.addAll(deletedFiles);
    return files;
  }
}
