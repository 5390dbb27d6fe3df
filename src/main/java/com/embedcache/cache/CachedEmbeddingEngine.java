package com.embedcache.cache;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.embedcache.EmbeddingCacheException;
import com.embedcache.embedding.ComputationFailedException;
import com.embedcache.embedding.EmbeddingFunction;
import com.embedcache.embedding.EmbeddingRequest;
import com.embedcache.store.KeyValueStore;
import com.embedcache.store.Namespace;

/**
 * Cache-aside batch embedding over a {@link KeyValueStore}.
 *
 * <p>Each call makes at most one store lookup, one embedding function invocation covering every
 * distinct miss, and one store write. The store is the only place vectors live between calls.
 */
public class CachedEmbeddingEngine {
    private static final Logger log = LoggerFactory.getLogger(CachedEmbeddingEngine.class);
    private final KeyValueStore store;
    private final EmbeddingFunction embeddingFunction;
    private final AtomicLong calls = new AtomicLong();
    private final AtomicLong requested = new AtomicLong();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong computeRuns = new AtomicLong();

    public CachedEmbeddingEngine(KeyValueStore store, EmbeddingFunction embeddingFunction) {
        this.store = store;
        this.embeddingFunction = embeddingFunction;
    }

    public List<float[]> embed(EmbeddingModelConfig config, List<String> sentences) {
        return embed(config, sentences, EmbedOptions.DEFAULT);
    }

    public float[] embedOne(EmbeddingModelConfig config, String sentence, EmbedOptions options) {
        return embed(config, List.of(sentence), options).get(0);
    }

    /**
     * Returns one vector per input sentence, in input order. Duplicate sentences are looked up and
     * computed once and yield equal vectors.
     *
     * @throws com.embedcache.store.StoreUnavailableException if the store fails
     * @throws ComputationFailedException if the embedding function fails or returns malformed output
     * @throws IntegrityException if vector counts or widths do not match the namespace
     */
    public List<float[]> embed(EmbeddingModelConfig config, List<String> sentences, EmbedOptions options) {
        if (config.backend() != embeddingFunction.backend()) {
            throw new IllegalArgumentException("Config targets backend " + config.backend()
                    + " but engine computes with " + embeddingFunction.backend());
        }
        for (String sentence : sentences) {
            if (sentence == null) {
                throw new IllegalArgumentException("sentences must not contain null");
            }
        }
        if (sentences.isEmpty()) {
            return new ArrayList<>();
        }

        int nativeDimension = embeddingFunction.dimension(new EmbeddingRequest(config.modelId(), false, null));
        Namespace namespace = NamespaceResolver.resolve(config, options.normalize(), nativeDimension);
        EmbeddingRequest request = new EmbeddingRequest(config.modelId(), options.normalize(), config.truncateDim());
        int dimension = embeddingFunction.dimension(request);
        store.ensureNamespace(namespace);

        Map<String, String> keyBySentence = new LinkedHashMap<>();
        for (String sentence : sentences) {
            keyBySentence.computeIfAbsent(sentence, CacheKeys::of);
        }
        Map<String, byte[]> stored = store.batchGet(namespace, new ArrayList<>(keyBySentence.values()));

        Map<String, float[]> vectors = new HashMap<>();
        List<String> missed = new ArrayList<>();
        for (Map.Entry<String, String> entry : keyBySentence.entrySet()) {
            byte[] value = stored.get(entry.getValue());
            if (value != null) {
                vectors.put(entry.getKey(), VectorCodec.decode(value, dimension));
            } else {
                missed.add(entry.getKey());
            }
        }

        if (!missed.isEmpty()) {
            List<float[]> computed = compute(missed, request, dimension);
            Map<String, byte[]> entries = new LinkedHashMap<>();
            for (int i = 0; i < missed.size(); i++) {
                String sentence = missed.get(i);
                vectors.put(sentence, computed.get(i));
                entries.put(keyBySentence.get(sentence), VectorCodec.encode(computed.get(i)));
            }
            store.batchPutIfAbsent(namespace, entries);
        }

        List<float[]> out = new ArrayList<>(sentences.size());
        for (String sentence : sentences) {
            out.add(vectors.get(sentence).clone());
        }

        recordCall(sentences.size(), keyBySentence.size() - missed.size(), missed.size());
        log.debug("Embedded namespace={} requested={} distinct={} hits={} misses={}",
                namespace, sentences.size(), keyBySentence.size(), keyBySentence.size() - missed.size(), missed.size());
        return out;
    }

    public CacheStatistics statistics() {
        return new CacheStatistics(calls.get(), requested.get(), hits.get(), misses.get(), computeRuns.get());
    }

    private List<float[]> compute(List<String> missed, EmbeddingRequest request, int dimension) {
        List<float[]> computed;
        try {
            computeRuns.incrementAndGet();
            computed = embeddingFunction.compute(List.copyOf(missed), request);
        } catch (EmbeddingCacheException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ComputationFailedException("Embedding function failed for " + missed.size() + " sentences", e);
        }
        if (computed == null) {
            throw new ComputationFailedException("Embedding function returned no result");
        }
        if (computed.size() != missed.size()) {
            throw new IntegrityException("Embedding function returned " + computed.size()
                    + " vectors for " + missed.size() + " sentences");
        }
        for (float[] vector : computed) {
            if (vector == null) {
                throw new ComputationFailedException("Embedding function returned a null vector");
            }
            if (vector.length != dimension) {
                throw new IntegrityException("Embedding function returned a vector of width " + vector.length
                        + ", expected " + dimension);
            }
        }
        return computed;
    }

    private void recordCall(int sentenceCount, int hitCount, int missCount) {
        calls.incrementAndGet();
        requested.addAndGet(sentenceCount);
        hits.addAndGet(hitCount);
        misses.addAndGet(missCount);
    }
}
