package com.embedcache.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Token and character-trigram hashing model. Trigram features let misspellings and inflections
 * land near their base word.
 */
public class LocalModelEmbeddingFunction implements EmbeddingFunction {
    private static final float TOKEN_WEIGHT = 1.0f;
    private static final float TRIGRAM_WEIGHT = 0.35f;
    private final int dimension;

    public LocalModelEmbeddingFunction(int dimension) {
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
        return EmbeddingBackend.LOCAL;
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
            addHashed(vector, modelId + ":tok:" + token, TOKEN_WEIGHT);
            if (token.length() >= 3) {
                for (int i = 0; i <= token.length() - 3; i++) {
                    addHashed(vector, modelId + ":tri:" + token.substring(i, i + 3), TRIGRAM_WEIGHT);
                }
            }
        }
        return vector;
    }

    private static void addHashed(float[] vector, String key, float weight) {
        int index = Math.floorMod(key.hashCode(), vector.length);
        vector[index] += weight;
    }
}
