package com.flamingo.ai.ragdocs.api.rest;

import static org.hamcrest.Matchers.contains;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.ragdocs.exception.ApiError;
import com.flamingo.ai.ragdocs.exception.GlobalExceptionHandler;
import com.flamingo.ai.ragdocs.exception.VectorStoreConnectionException;
import com.flamingo.ai.ragdocs.service.rag.RetrievalService;
import com.flamingo.ai.ragdocs.service.rag.SyncReport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("TechnologyController Tests")
class TechnologyControllerTest {

  private MockMvc mockMvc;

  @Mock private RetrievalService retrievalService;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new TechnologyController(retrievalService), new HealthController(retrievalService))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  @DisplayName("Should sync a technology and return the report")
  void shouldSyncTechnology() throws Exception {
    when(retrievalService.sync("milvus", Path.of("data/milvus_docs")))
        .thenReturn(new SyncReport("milvus", 2, 1, 0, 7, List.of("/bad.md"), List.of()));

    mockMvc
        .perform(
            post("/api/technologies/{technology}/sync", "milvus")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"path\":\"data/milvus_docs\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.technology").value("milvus"))
        .andExpect(jsonPath("$.newFiles").value(2))
        .andExpect(jsonPath("$.modifiedFiles").value(1))
        .andExpect(jsonPath("$.deletedFiles").value(0))
        .andExpect(jsonPath("$.chunksIndexed").value(7))
        .andExpect(jsonPath("$.failedFiles[0]").value("/bad.md"));
  }

  @Test
  @DisplayName("Should reject a sync request without a path")
  void shouldRejectMissingPath() throws Exception {
    mockMvc
        .perform(
            post("/api/technologies/{technology}/sync", "milvus")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR));

    verifyNoInteractions(retrievalService);
  }

  @Test
  @DisplayName("Should return 503 when the vector store is unreachable")
  void shouldReturnServiceUnavailable() throws Exception {
    when(retrievalService.sync("milvus", Path.of("docs")))
        .thenThrow(new VectorStoreConnectionException("connection refused"));

    mockMvc
        .perform(
            post("/api/technologies/{technology}/sync", "milvus")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"path\":\"docs\"}"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value(ApiError.STORE_UNREACHABLE))
        .andExpect(jsonPath("$.path").value("/api/technologies/milvus/sync"));
  }

  @Test
  @DisplayName("Should list available technologies in sync order")
  void shouldListTechnologies() throws Exception {
    when(retrievalService.getAvailableTechnologies())
        .thenReturn(new LinkedHashSet<>(List.of("milvus", "qdrant")));

    mockMvc
        .perform(get("/api/technologies"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", contains("milvus", "qdrant")));
  }

  @Test
  @DisplayName("Should list categories")
  void shouldListCategories() throws Exception {
    when(retrievalService.getCategories())
        .thenReturn(new LinkedHashSet<>(List.of("deployment", "security")));

    mockMvc
        .perform(get("/api/categories"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", contains("deployment", "security")));
  }

  @Test
  @DisplayName("Health endpoint should report status and technologies")
  void shouldReportHealth() throws Exception {
    when(retrievalService.getAvailableTechnologies())
        .thenReturn(new LinkedHashSet<>(List.of("weaviate")));

    mockMvc
        .perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("UP"))
        .andExpect(jsonPath("$.service").value("ragdocs"))
        .andExpect(jsonPath("$.technologies[0]").value("weaviate"));
  }
}
