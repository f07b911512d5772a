package com.flamingo.ai.ragdocs.service.rag;

import com.flamingo.ai.ragdocs.config.RagConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Converts the raw distance the index reports for a hit into a relevance score {@code 1 - d²/4},
 * where {@code d} is that raw value (the squared Euclidean distance for {@code l2_norm}).
 *
 * <p>Identical vectors score 1. The score drops quadratically and goes negative once the raw
 * distance exceeds 2; with clamping enabled it is kept in [0, 1].
 */
@Component
public class ScoreNormalizer {

  private final boolean clamp;

  @Autowired
  public ScoreNormalizer(RagConfig ragConfig) {
    this(ragConfig.getRetrieval().isClampScores());
  }

  public ScoreNormalizer(boolean clamp) {
    this.clamp = clamp;
  }

  public double normalize(double distance) {
    double score = 1.0 - distance * distance / 4.0;
    return clamp ? Math.min(1.0, Math.max(0.0, score)) : score;
  }
}
