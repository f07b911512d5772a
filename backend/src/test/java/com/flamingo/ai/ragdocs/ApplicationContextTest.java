package com.flamingo.ai.ragdocs;

import static org.assertj.core.api.Assertions.assertThat;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import com.flamingo.ai.ragdocs.elasticsearch.ChunkIndexOperations;
import com.flamingo.ai.ragdocs.service.rag.RetrievalService;
import com.flamingo.ai.ragdocs.service.tracking.ChangeTracker;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies the Spring application context loads. The embedding model and Elasticsearch client are
 * mocked so the test runs without external services.
 */
@SpringBootTest
@ActiveProfiles("test")
class ApplicationContextTest {

  @MockitoBean private EmbeddingModel embeddingModel;
  @MockitoBean private ElasticsearchClient elasticsearchClient;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("Pipeline beans should be available")
  void pipelineBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(RetrievalService.class)).isNotNull();
    assertThat(applicationContext.getBean(ChangeTracker.class)).isNotNull();
    assertThat(applicationContext.getBean(ChunkIndexOperations.class)).isNotNull();
  }
}
