package com.embedcache.embedding;

import java.util.List;

/**
 * A deterministic, batch-capable sentence embedding model.
 *
 * <p>{@link #compute} returns one vector per input sentence in input order, every vector
 * {@link #dimension} components wide. Implementations apply truncation before normalization.
 */
public interface EmbeddingFunction {
    List<float[]> compute(List<String> sentences, EmbeddingRequest request);

    int dimension(EmbeddingRequest request);

    EmbeddingBackend backend();
}
