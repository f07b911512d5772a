package com.flamingo.ai.ragdocs.api.rest;

import com.flamingo.ai.ragdocs.api.dto.request.SyncRequest;
import com.flamingo.ai.ragdocs.api.dto.response.SyncReportResponse;
import com.flamingo.ai.ragdocs.service.rag.RetrievalService;
import com.flamingo.ai.ragdocs.service.rag.SyncReport;
import jakarta.validation.Valid;
import java.nio.file.Path;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for technologies, their sync and the category list. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class TechnologyController {

  private final RetrievalService retrievalService;

  /** Syncs a technology's documentation directory into the index. */
  @PostMapping("/technologies/{technology}/sync")
  public ResponseEntity<SyncReportResponse> sync(
      @PathVariable String technology, @Valid @RequestBody SyncRequest request) {
    SyncReport report = retrievalService.sync(technology, Path.of(request.getPath()));
    return ResponseEntity.ok(SyncReportResponse.fromReport(report));
  }

  /** Lists technologies that have been synced at least once. */
  @GetMapping("/technologies")
  public ResponseEntity<Set<String>> getTechnologies() {
    return ResponseEntity.ok(retrievalService.getAvailableTechnologies());
  }

  /** Lists the category names chunks are classified into. */
  @GetMapping("/categories")
  public ResponseEntity<Set<String>> getCategories() {
    return ResponseEntity.ok(retrievalService.getCategories());
  }
}
