package com.flamingo.ai.ragdocs.api.rest;

import com.flamingo.ai.ragdocs.service.rag.RetrievalService;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final RetrievalService retrievalService;

  /** Returns a simple health check response. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "ragdocs");
    health.put("technologies", retrievalService.getAvailableTechnologies());
    return ResponseEntity.ok(health);
  }
}
