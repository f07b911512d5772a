package com.flamingo.ai.ragdocs.service.rag.segmentation;

/**
 * A bounded section ready to become a chunk.
 *
 * @param title section title, at most the configured title length
 * @param level header depth 1-6, 0 for untitled content
 * @param content trimmed section text, at most the configured content length
 */
public record SectionCandidate(String title, int level, String content) {}
