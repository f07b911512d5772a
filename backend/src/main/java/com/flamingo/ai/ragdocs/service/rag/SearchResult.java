package com.flamingo.ai.ragdocs.service.rag;

/**
 * A chunk returned by a search, with its relevance score.
 *
 * @param score normalized relevance, 1.0 for an identical vector
 */
public record SearchResult(
    String content,
    String technology,
    String filePath,
    String sectionTitle,
    int sectionLevel,
    String category,
    double score) {}
