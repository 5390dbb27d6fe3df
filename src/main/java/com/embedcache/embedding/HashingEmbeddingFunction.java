package com.embedcache.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class HashingEmbeddingFunction implements EmbeddingFunction {
    private final int dimension;

    public HashingEmbeddingFunction(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public List<float[]> compute(List<String> sentences, EmbeddingRequest request) {
        List<float[]> out = new ArrayList<>(sentences.size());
        for (String sentence : sentences) {
            out.add(Vectors.finish(embed(sentence, request.modelId()), request));
        }
        return out;
    }

    @Override
    public int dimension(EmbeddingRequest request) {
        return request.outputDimension(dimension);
    }

    @Override
    public EmbeddingBackend backend() {
        return EmbeddingBackend.HASHING;
    }

    private float[] embed(String text, String modelId) {
        float[] vector = new float[dimension];
        if (text.isBlank()) {
            return vector;
        }

        String[] tokens = text.toLowerCase(Locale.ROOT).split("\\W+");
        for (String token : tokens) {
            if (token.isBlank()) {
                continue;
            }
            int index = Math.floorMod((modelId + ':' + token).hashCode(), dimension);
            vector[index] += 1f;
        }
        return vector;
    }
}
