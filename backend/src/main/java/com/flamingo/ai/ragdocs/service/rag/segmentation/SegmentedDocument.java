package com.flamingo.ai.ragdocs.service.rag.segmentation;

import java.util.List;
import java.util.Map;

/**
 * A markdown document turned into ordered sections.
 *
 * @param frontmatter metadata from the frontmatter block, empty when none could be read
 * @param sections sections in document order
 */
public record SegmentedDocument(Map<String, Object> frontmatter, List<SectionCandidate> sections) {

  public SegmentedDocument {
    frontmatter = Map.copyOf(frontmatter);
    sections = List.copyOf(sections);
  }
}
