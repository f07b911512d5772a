package com.flamingo.ai.ragdocs.config;

import com.flamingo.ai.ragdocs.elasticsearch.ChunkIndexOperations;
import com.flamingo.ai.ragdocs.service.rag.RetrievalService;
import com.flamingo.ai.ragdocs.service.rag.SyncReport;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Startup bean that syncs the configured documentation sources.
 *
 * <p>Runs once on application startup and:
 *
 * <ul>
 *   <li>Pings Elasticsearch; an unreachable store aborts startup
 *   <li>Syncs every configured source in order
 * </ul>
 *
 * <p>A source that fails to sync is logged and the remaining sources still run.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DocumentationSyncStartupBean implements CommandLineRunner {

  private final RagConfig ragConfig;
  private final RetrievalService retrievalService;
  private final ChunkIndexOperations chunkIndex;

  @Override
  public void run(String... args) {
    RagConfig.Sync sync = ragConfig.getSync();
    if (sync.isVerifyConnection()) {
      chunkIndex.verifyConnection();
    }
    if (!sync.isOnStartup()) {
      log.info("Startup sync disabled");
      return;
    }
    if (ragConfig.getSources().isEmpty()) {
      log.info("No documentation sources configured, skipping startup sync");
      return;
    }

    int succeeded = 0;
    for (RagConfig.Source source : ragConfig.getSources()) {
      try {
        SyncReport report =
            retrievalService.sync(source.getTechnology(), Path.of(source.getPath()));
        log.info(
            "Startup sync of {}: {} new, {} modified, {} deleted",
            report.technology(),
            report.newFiles(),
            report.modifiedFiles(),
            report.deletedFiles());
        succeeded++;
      } catch (RuntimeException e) {
        log.error(
            "Startup sync of {} from {} failed: {}",
            source.getTechnology(),
            source.getPath(),
            e.getMessage(),
            e);
      }
    }
    log.info(
        "Startup sync completed: {}/{} sources synced", succeeded, ragConfig.getSources().size());
  }
}
