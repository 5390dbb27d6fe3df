package com.embedcache.embedding;

import java.util.Arrays;

final class Vectors {
    private Vectors() {
    }

    static float[] finish(float[] vector, EmbeddingRequest request) {
        float[] out = vector;
        if (request.truncateDim() != null && request.truncateDim() < vector.length) {
            out = Arrays.copyOf(vector, request.truncateDim());
        }
        if (request.normalize()) {
            normalize(out);
        }
        return out;
    }

    static void normalize(float[] vector) {
        float norm = 0f;
        for (float value : vector) {
            norm += value * value;
        }
        norm = (float) Math.sqrt(norm);
        if (norm <= 0f) {
            return;
        }
        for (int i = 0; i < vector.length; i++) {
            vector[i] /= norm;
        }
    }
}
