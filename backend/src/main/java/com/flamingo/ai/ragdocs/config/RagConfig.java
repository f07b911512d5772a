package com.flamingo.ai.ragdocs.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the indexing and retrieval pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private List<Source> sources = new ArrayList<>();
  private Sync sync = new Sync();
  private Tracking tracking = new Tracking();
  private Segmentation segmentation = new Segmentation();
  private Index index = new Index();
  private Retrieval retrieval = new Retrieval();
  private Embedding embedding = new Embedding();

  /**
   * Category name to keyword list. Iteration order is the tie-break order used by the classifier,
   * so the default is a {@link LinkedHashMap}.
   */
  private Map<String, List<String>> categories = defaultCategories();

  /** A documentation directory indexed under one technology name. */
  @Getter
  @Setter
  public static class Source {
    private String technology;
    private String path;
  }

  @Getter
  @Setter
  public static class Sync {
    /** Whether configured sources are synced when the application starts. */
    private boolean onStartup = true;

    /** Whether the vector store is pinged before the startup sync; unreachable store is fatal. */
    private boolean verifyConnection = true;
  }

  @Getter
  @Setter
  public static class Tracking {
    private String cacheFile = ".rag_cache.json";
    private String extension = ".md";
  }

  @Getter
  @Setter
  public static class Segmentation {
    private int maxTitleLength = 512;
    private int maxContentLength = 65535;
  }

  @Getter
  @Setter
  public static class Index {
    private String name = "docs_tech";
    private int vectorDimensions = 384;
    private int shards = 2;

    /** HNSW graph degree. */
    private int hnswM = 8;

    /** HNSW construction breadth. */
    private int hnswEfConstruction = 64;

    /** Candidates examined per shard at query time (kNN num_candidates). */
    private int searchBreadth = 64;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int defaultTopK = 3;

    /** Clamp normalized scores into [0, 1]; a raw hit distance above 2 would go negative. */
    private boolean clampScores = true;
  }

  @Getter
  @Setter
  public static class Embedding {
    /** "local" (all-MiniLM-L6-v2 via ONNX) or "openai". */
    private String provider = "local";

    private int batchSize = 32;
    private int maxInputChars = 8000;
  }

  private static Map<String, List<String>> defaultCategories() {
    Map<String, List<String>> categories = new LinkedHashMap<>();
    categories.put("deployment", List.of("deployment", "install", "setup", "configuration"));
    categories.put("performance", List.of("performance", "speed", "latency", "throughput"));
    categories.put("features", List.of("feature", "functionality", "capability"));
    categories.put("scalability", List.of("scale", "scalability", "distributed", "cluster"));
    categories.put("security", List.of("security", "authentication", "encryption"));
    categories.put("integration", List.of("integration", "connector", "plugin"));
    return categories;
  }
}
