package com.flamingo.ai.ragdocs.config;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.ragdocs.elasticsearch.ChunkIndexOperations;
import com.flamingo.ai.ragdocs.exception.StorageException;
import com.flamingo.ai.ragdocs.exception.VectorStoreConnectionException;
import com.flamingo.ai.ragdocs.service.rag.RetrievalService;
import com.flamingo.ai.ragdocs.service.rag.SyncReport;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("DocumentationSyncStartupBean Tests")
class DocumentationSyncStartupBeanTest {

  @Mock private RetrievalService retrievalService;
  @Mock private ChunkIndexOperations chunkIndex;

  private RagConfig ragConfig;
  private DocumentationSyncStartupBean startupBean;

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    startupBean = new DocumentationSyncStartupBean(ragConfig, retrievalService, chunkIndex);
  }

  private void addSource(String technology, String path) {
    RagConfig.Source source = new RagConfig.Source();
    source.setTechnology(technology);
    source.setPath(path);
    ragConfig.getSources().add(source);
  }

  private static SyncReport emptyReport(String technology) {
    return new SyncReport(technology, 0, 0, 0, 0, List.of(), List.of());
  }

  @Test
  @DisplayName("Should sync every configured source in order")
  void shouldSyncAllSources() {
    addSource("milvus", "data/milvus_docs");
    addSource("qdrant", "data/qdrant_docs");
    when(retrievalService.sync("milvus", Path.of("data/milvus_docs")))
        .thenReturn(emptyReport("milvus"));
    when(retrievalService.sync("qdrant", Path.of("data/qdrant_docs")))
        .thenReturn(emptyReport("qdrant"));

    startupBean.run();

    InOrder order = Mockito.inOrder(chunkIndex, retrievalService);
    order.verify(chunkIndex).verifyConnection();
    order.verify(retrievalService).sync("milvus", Path.of("data/milvus_docs"));
    order.verify(retrievalService).sync("qdrant", Path.of("data/qdrant_docs"));
  }

  @Test
  @DisplayName("Should keep syncing when one source fails")
  void shouldContinueAfterFailedSource() {
    addSource("milvus", "data/milvus_docs");
    addSource("qdrant", "data/qdrant_docs");
    when(retrievalService.sync("milvus", Path.of("data/milvus_docs")))
        .thenThrow(new StorageException("bulk failed"));
    when(retrievalService.sync("qdrant", Path.of("data/qdrant_docs")))
        .thenReturn(emptyReport("qdrant"));

    startupBean.run();

    verify(retrievalService).sync("qdrant", Path.of("data/qdrant_docs"));
  }

  @Test
  @DisplayName("Should abort startup when the store is unreachable")
  void shouldFailWhenStoreUnreachable() {
    addSource("milvus", "data/milvus_docs");
    Mockito.doThrow(new VectorStoreConnectionException("Connection refused"))
        .when(chunkIndex)
        .verifyConnection();

    assertThatThrownBy(() -> startupBean.run())
        .isInstanceOf(VectorStoreConnectionException.class);
    verifyNoInteractions(retrievalService);
  }

  @Test
  @DisplayName("Should do nothing when startup sync is disabled")
  void shouldSkipWhenDisabled() {
    addSource("milvus", "data/milvus_docs");
    ragConfig.getSync().setOnStartup(false);
    ragConfig.getSync().setVerifyConnection(false);

    startupBean.run();

    verifyNoInteractions(retrievalService, chunkIndex);
  }

  @Test
  @DisplayName("Should skip the sync when no sources are configured")
  void shouldSkipWithoutSources() {
    startupBean.run();

    verify(chunkIndex).verifyConnection();
    verifyNoInteractions(retrievalService);
  }
}
