package com.flamingo.ai.ragdocs.service.rag.segmentation;

import com.flamingo.ai.ragdocs.config.RagConfig;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Labels a section with the category that has the most of its keywords present in it.
 *
 * <p>Matching is case-insensitive substring search over {@code title + " " + content}; a keyword
 * counts once however often it appears. Ties go to the category listed first in the
 * configuration; no match at all yields {@link #GENERAL}.
 */
@Component
@Slf4j
public class CategoryClassifier {

  public static final String GENERAL = "general";

  private final Map<String, List<String>> keywordsByCategory;

  public CategoryClassifier(RagConfig ragConfig) {
    this(ragConfig.getCategories());
  }

  public CategoryClassifier(Map<String, List<String>> categories) {
    Map<String, List<String>> normalized = new LinkedHashMap<>();
    categories.forEach(
        (category, keywords) ->
            normalized.put(
                category,
                keywords.stream()
                    .filter(k -> k != null && !k.isBlank())
                    .map(k -> k.toLowerCase(Locale.ROOT))
                    .toList()));
    this.keywordsByCategory = Collections.unmodifiableMap(normalized);
    log.debug("Category keywords: {}", keywordsByCategory);
  }

  public String classify(String content, String title) {
    String text =
        ((title == null ? "" : title) + " " + (content == null ? "" : content))
            .toLowerCase(Locale.ROOT);

    String best = GENERAL;
    int bestCount = 0;
    for (Map.Entry<String, List<String>> entry : keywordsByCategory.entrySet()) {
      int count = 0;
      for (String keyword : entry.getValue()) {
        if (text.contains(keyword)) {
          count++;
        }
      }
      if (count > bestCount) {
        best = entry.getKey();
        bestCount = count;
      }
    }
    return best;
  }

  /** Configured category names in tie-break order. */
  public Set<String> categories() {
    return keywordsByCategory.keySet();
  }
}
