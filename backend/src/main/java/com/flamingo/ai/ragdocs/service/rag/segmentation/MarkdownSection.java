package com.flamingo.ai.ragdocs.service.rag.segmentation;

/**
 * A header-delimited span of a markdown text, before bounding.
 *
 * @param title header text, or {@link MarkdownSegmenter#UNTITLED} for content outside any header
 * @param level header depth 1-6, 0 for untitled content
 * @param startOffset offset of the first character of the span, inclusive
 * @param endOffset offset just past the span
 * @param content the span itself, header line included
 */
public record MarkdownSection(
    String title, int level, int startOffset, int endOffset, String content) {}
