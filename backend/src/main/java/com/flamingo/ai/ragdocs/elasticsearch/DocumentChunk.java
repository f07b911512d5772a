package com.flamingo.ai.ragdocs.elasticsearch;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One retrievable section of a documentation file, stored in Elasticsearch with its embedding.
 *
 * <p>Chunks are never updated in place: when the source file changes, every chunk of that path is
 * deleted and the new ones inserted. {@code fileHash} is the content hash the file had when the
 * chunk was produced.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentChunk {

  /** Assigned by Elasticsearch on insert; null for chunks not yet stored. */
  private String id;

  private String content;
  private String technology;
  private String filePath;
  private String fileHash;
  private String sectionTitle;

  /** 1-6 for header sections, 0 for untitled content. */
  private int sectionLevel;

  private String category;
  private List<Float> embedding;
}
