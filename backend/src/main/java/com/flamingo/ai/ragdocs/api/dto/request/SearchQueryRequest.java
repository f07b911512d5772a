package com.flamingo.ai.ragdocs.api.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a filtered documentation search. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchQueryRequest {

  @NotBlank(message = "Query is required")
  @Size(max = 2000, message = "Query must not exceed 2000 characters")
  private String query;

  /** Technologies to search. Empty or absent searches all of them. */
  private List<String> technologies;

  /** Categories to search. Empty or absent searches all of them. */
  private List<String> categories;

  /** Results per technology. If null, the configured default is used. */
  @Min(value = 1, message = "topK must be at least 1")
  @Max(value = 100, message = "topK must not exceed 100")
  private Integer topK;
}
