package com.flamingo.ai.ragdocs.elasticsearch;

/**
 * A search hit with the raw squared Euclidean distance between query and chunk embedding.
 *
 * @param chunk the stored chunk, without its embedding
 * @param distance squared L2 distance; 0 for identical vectors
 */
public record ChunkHit(DocumentChunk chunk, double distance) {}
