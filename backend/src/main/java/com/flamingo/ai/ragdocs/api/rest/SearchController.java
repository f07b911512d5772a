package com.flamingo.ai.ragdocs.api.rest;

import com.flamingo.ai.ragdocs.api.dto.request.SearchQueryRequest;
import com.flamingo.ai.ragdocs.api.dto.response.SearchResultResponse;
import com.flamingo.ai.ragdocs.config.RagConfig;
import com.flamingo.ai.ragdocs.service.rag.RetrievalService;
import com.flamingo.ai.ragdocs.service.rag.SearchResult;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for filtered semantic search over the indexed documentation. */
@RestController
@RequestMapping("/api/search")
@RequiredArgsConstructor
public class SearchController {

  private final RetrievalService retrievalService;
  private final RagConfig ragConfig;

  /** Searches the documentation; results are grouped by technology. */
  @PostMapping
  public ResponseEntity<Map<String, List<SearchResultResponse>>> search(
      @Valid @RequestBody SearchQueryRequest request) {
    int topK =
        request.getTopK() != null ? request.getTopK() : ragConfig.getRetrieval().getDefaultTopK();
    Map<String, List<SearchResult>> results =
        retrievalService.search(
            request.getQuery(), request.getTechnologies(), request.getCategories(), topK);

    Map<String, List<SearchResultResponse>> response = new LinkedHashMap<>();
    results.forEach(
        (technology, group) ->
            response.put(
                technology, group.stream().map(SearchResultResponse::fromResult).toList()));
    return ResponseEntity.ok(response);
  }
}
