package com.flamingo.ai.ragdocs.api.dto.response;

import com.flamingo.ai.ragdocs.service.rag.SearchResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one search hit. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResultResponse {

  private String content;
  private String technology;
  private String filePath;
  private String sectionTitle;
  private int sectionLevel;
  private String category;
  private double score;

  public static SearchResultResponse fromResult(SearchResult result) {
    return SearchResultResponse.builder()
        .content(result.content())
        .technology(result.technology())
        .filePath(result.filePath())
        .sectionTitle(result.sectionTitle())
        .sectionLevel(result.sectionLevel())
        .category(result.category())
        .score(result.score())
        .build();
  }
}
