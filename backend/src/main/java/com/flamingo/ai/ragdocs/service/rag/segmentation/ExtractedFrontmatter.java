package com.flamingo.ai.ragdocs.service.rag.segmentation;

import java.util.Map;

/**
 * Result of frontmatter extraction.
 *
 * @param metadata parsed key/value block, empty when absent or malformed
 * @param body the text following the block, or the whole input when no block was taken
 */
public record ExtractedFrontmatter(Map<String, Object> metadata, String body) {

  public ExtractedFrontmatter {
    metadata = Map.copyOf(metadata);
  }

  static ExtractedFrontmatter none(String text) {
    return new ExtractedFrontmatter(Map.of(), text);
  }
}
