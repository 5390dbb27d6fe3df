package com.embedcache.embedding;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Remote embedding provider. The whole batch goes out in one POST of
 * {@code {"model": ..., "input": [...]}}; the response may be OpenAI-style
 * ({@code data[].embedding}) or a bare {@code embeddings} array.
 */
public class HttpEmbeddingFunction implements EmbeddingFunction {
    private static final Logger log = LoggerFactory.getLogger(HttpEmbeddingFunction.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String apiKey;
    private final int dimension;

    public HttpEmbeddingFunction(OkHttpClient httpClient, String endpoint, String apiKey, int dimension) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("HTTP embedding backend requires an endpoint");
        }
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive: " + dimension);
        }
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.dimension = dimension;
    }

    @Override
    public List<float[]> compute(List<String> sentences, EmbeddingRequest request) {
        if (sentences.isEmpty()) {
            return List.of();
        }
        try {
            Request.Builder requestBuilder = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(payload(sentences, request), JSON));
            if (apiKey != null && !apiKey.isBlank()) {
                requestBuilder.header("Authorization", "Bearer " + apiKey);
            }
            try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                ResponseBody body = response.body();
                if (!response.isSuccessful() || body == null) {
                    throw new ComputationFailedException("Embedding provider returned HTTP " + response.code());
                }
                List<float[]> vectors = parse(mapper.readTree(body.string()));
                log.debug("Embedding provider returned {} vectors for {} sentences", vectors.size(), sentences.size());
                List<float[]> out = new ArrayList<>(vectors.size());
                for (float[] vector : vectors) {
                    out.add(Vectors.finish(vector, request));
                }
                return out;
            }
        } catch (IOException e) {
            throw new ComputationFailedException("Embedding provider call failed: " + endpoint, e);
        }
    }

    @Override
    public int dimension(EmbeddingRequest request) {
        return request.outputDimension(dimension);
    }

    @Override
    public EmbeddingBackend backend() {
        return EmbeddingBackend.HTTP;
    }

    private String payload(List<String> sentences, EmbeddingRequest request) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", request.modelId());
        payload.put("input", sentences);
        if (request.truncateDim() != null) {
            payload.put("dimensions", request.truncateDim());
        }
        return mapper.writeValueAsString(payload);
    }

    private List<float[]> parse(JsonNode root) {
        JsonNode data = root.path("data");
        if (data.isArray()) {
            float[][] ordered = new float[data.size()][];
            for (int i = 0; i < data.size(); i++) {
                JsonNode item = data.get(i);
                int position = item.path("index").asInt(i);
                if (position < 0 || position >= ordered.length || ordered[position] != null) {
                    throw new ComputationFailedException("Embedding provider returned invalid index " + position);
                }
                ordered[position] = toVector(item.path("embedding"));
            }
            return Arrays.asList(ordered);
        }
        JsonNode embeddings = root.path("embeddings");
        if (embeddings.isArray()) {
            List<float[]> out = new ArrayList<>(embeddings.size());
            for (JsonNode node : embeddings) {
                out.add(toVector(node));
            }
            return out;
        }
        throw new ComputationFailedException("Embedding provider response has neither data nor embeddings");
    }

    private static float[] toVector(JsonNode vectorNode) {
        if (!vectorNode.isArray()) {
            throw new ComputationFailedException("Embedding provider returned a non-array embedding");
        }
        float[] out = new float[vectorNode.size()];
        for (int i = 0; i < vectorNode.size(); i++) {
            JsonNode component = vectorNode.get(i);
            if (!component.isNumber()) {
                throw new ComputationFailedException("Embedding provider returned a non-numeric component");
            }
            out[i] = component.floatValue();
        }
        return out;
    }
}
