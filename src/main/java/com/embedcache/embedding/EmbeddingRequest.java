package com.embedcache.embedding;

/**
 * Per-call model settings handed to an {@link EmbeddingFunction}. {@code truncateDim} is null when
 * vectors keep the model's native width.
 */
public record EmbeddingRequest(String modelId, boolean normalize, Integer truncateDim) {
    public EmbeddingRequest {
        if (modelId == null || modelId.isBlank()) {
            throw new IllegalArgumentException("modelId is required");
        }
        if (truncateDim != null && truncateDim <= 0) {
            throw new IllegalArgumentException("truncateDim must be positive: " + truncateDim);
        }
    }

    int outputDimension(int nativeDimension) {
        return truncateDim == null ? nativeDimension : Math.min(truncateDim, nativeDimension);
    }
}
