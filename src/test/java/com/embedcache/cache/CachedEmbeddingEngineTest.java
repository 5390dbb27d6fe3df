package com.embedcache.cache;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.embedcache.embedding.ComputationFailedException;
import com.embedcache.embedding.EmbeddingBackend;
import com.embedcache.embedding.EmbeddingFunction;
import com.embedcache.embedding.EmbeddingRequest;
import com.embedcache.embedding.LocalModelEmbeddingFunction;
import com.embedcache.store.Namespace;
import com.embedcache.store.StoreUnavailableException;

class CachedEmbeddingEngineTest {
    private static final EmbeddingModelConfig CONFIG = new EmbeddingModelConfig(EmbeddingBackend.LOCAL, "length-v1", null);

    private RecordingKeyValueStore store;
    private LengthEmbeddingFunction function;
    private CachedEmbeddingEngine engine;

    @BeforeEach
    void setUp() {
        store = new RecordingKeyValueStore();
        function = new LengthEmbeddingFunction();
        engine = new CachedEmbeddingEngine(store, function);
    }

    @Test
    void shouldComputeDistinctSentencesOnceAndServeRepeatCallsFromStore() {
        List<String> sentences = List.of("hello", "world", "hello");

        List<float[]> first = engine.embed(CONFIG, sentences);

        assertEquals(3, first.size());
        for (float[] vector : first) {
            assertArrayEquals(new float[] { 5f }, vector);
        }
        assertEquals(List.of(List.of("hello", "world")), function.batches);

        List<float[]> second = engine.embed(CONFIG, sentences);

        assertEquals(1, function.calls());
        for (int i = 0; i < first.size(); i++) {
            assertArrayEquals(first.get(i), second.get(i));
        }
    }

    @Test
    void shouldDeduplicateBeforeLookupAndComputation() {
        List<float[]> out = engine.embed(CONFIG, List.of("a", "b", "a"));

        assertEquals(List.of(List.of("a", "b")), function.batches);
        assertEquals(1, store.lookups.size());
        assertEquals(List.of(CacheKeys.of("a"), CacheKeys.of("b")), store.lookups.get(0));
        assertEquals(3, out.size());
        assertArrayEquals(out.get(0), out.get(2));
        assertNotSame(out.get(0), out.get(2));
    }

    @Test
    void shouldPreserveInputOrderAcrossHitsAndMisses() {
        engine.embed(CONFIG, List.of("yy"));

        List<float[]> out = engine.embed(CONFIG, List.of("x", "yy", "zzz"));

        assertArrayEquals(new float[] { 1f }, out.get(0));
        assertArrayEquals(new float[] { 2f }, out.get(1));
        assertArrayEquals(new float[] { 3f }, out.get(2));
        assertEquals(List.of("x", "zzz"), function.batches.get(1));
    }

    @Test
    void shouldIsolateNamespacesByNormalizeFlag() {
        List<float[]> raw = engine.embed(CONFIG, List.of("s"), EmbedOptions.DEFAULT);
        List<float[]> normalized = engine.embed(CONFIG, List.of("sentence"), EmbedOptions.NORMALIZED);
        List<float[]> normalizedS = engine.embed(CONFIG, List.of("s"), EmbedOptions.NORMALIZED);

        assertEquals(3, function.calls());
        assertArrayEquals(new float[] { 1f }, raw.get(0));
        assertArrayEquals(new float[] { 1f }, normalized.get(0));
        assertArrayEquals(new float[] { 1f }, normalizedS.get(0));

        Namespace rawNamespace = NamespaceResolver.resolve(CONFIG, false, 1);
        Namespace normalizedNamespace = NamespaceResolver.resolve(CONFIG, true, 1);
        assertEquals(1, store.size(rawNamespace));
        assertEquals(2, store.size(normalizedNamespace));
    }

    @Test
    void shouldIsolateNamespacesByModelAndTruncation() {
        engine.embed(CONFIG, List.of("s"));
        engine.embed(new EmbeddingModelConfig(EmbeddingBackend.LOCAL, "length-v2", null), List.of("s"));
        engine.embed(new EmbeddingModelConfig(EmbeddingBackend.LOCAL, "length-v1", 1), List.of("s"));

        assertEquals(3, function.calls());
    }

    @Test
    void shouldIsolateNamespacesByNativeWidth() {
        EmbeddingModelConfig trigram = new EmbeddingModelConfig(EmbeddingBackend.LOCAL, "local-trigram-v1", null);
        CachedEmbeddingEngine wide = new CachedEmbeddingEngine(store, new LocalModelEmbeddingFunction(16));
        CachedEmbeddingEngine narrow = new CachedEmbeddingEngine(store, new LocalModelEmbeddingFunction(8));

        assertEquals(16, wide.embedOne(trigram, "hello", EmbedOptions.DEFAULT).length);
        assertEquals(8, narrow.embedOne(trigram, "hello", EmbedOptions.DEFAULT).length);

        Namespace wideNamespace = NamespaceResolver.resolve(trigram, false, 16);
        Namespace narrowNamespace = NamespaceResolver.resolve(trigram, false, 8);
        assertNotEquals(wideNamespace, narrowNamespace);
        assertEquals(1, store.size(wideNamespace));
        assertEquals(1, store.size(narrowNamespace));
        assertEquals(0, narrow.statistics().hits());
    }

    @Test
    void shouldReturnEmptyOutputWithoutTouchingStoreOrModel() {
        List<float[]> out = engine.embed(CONFIG, List.of());

        assertTrue(out.isEmpty());
        assertTrue(store.operations.isEmpty());
        assertEquals(0, function.calls());
    }

    @Test
    void shouldIssueOneLookupAndOneWritePerCall() {
        engine.embed(CONFIG, List.of("one", "two", "three", "two"));

        Namespace namespace = NamespaceResolver.resolve(CONFIG, false, 1);
        assertEquals(List.of("ensure:" + namespace, "get:" + namespace, "put:" + namespace), store.operations);
    }

    @Test
    void shouldSkipWriteWhenEverySentenceHits() {
        engine.embed(CONFIG, List.of("cached"));
        store.operations.clear();

        engine.embed(CONFIG, List.of("cached", "cached"));

        assertTrue(store.operations.stream().noneMatch(op -> op.startsWith("put:")));
        assertEquals(1, function.calls());
    }

    @Test
    void shouldFailWhenModelReturnsWrongVectorCount() {
        CachedEmbeddingEngine broken = new CachedEmbeddingEngine(store, new FixedEmbeddingFunction(List.of(new float[] { 1f })));

        assertThrows(IntegrityException.class, () -> broken.embed(CONFIG, List.of("a", "b")));
        assertEquals(0, store.size(NamespaceResolver.resolve(CONFIG, false, 1)));
    }

    @Test
    void shouldFailWhenModelReturnsWrongWidth() {
        CachedEmbeddingEngine broken = new CachedEmbeddingEngine(store, new FixedEmbeddingFunction(List.of(new float[] { 1f, 2f })));

        assertThrows(IntegrityException.class, () -> broken.embed(CONFIG, List.of("a")));
    }

    @Test
    void shouldFailWhenStoredValueHasWrongLength() {
        Namespace namespace = NamespaceResolver.resolve(CONFIG, false, 1);
        store.ensureNamespace(namespace);
        store.batchPutIfAbsent(namespace, Map.of(CacheKeys.of("bad"), new byte[] { 1, 2, 3 }));

        assertThrows(IntegrityException.class, () -> engine.embed(CONFIG, List.of("bad")));
        assertEquals(0, function.calls());
    }

    @Test
    void shouldWrapModelFailures() {
        EmbeddingFunction failing = new FixedEmbeddingFunction(null) {
            @Override
            public List<float[]> compute(List<String> sentences, EmbeddingRequest request) {
                throw new IllegalStateException("model crashed");
            }
        };
        CachedEmbeddingEngine broken = new CachedEmbeddingEngine(store, failing);

        ComputationFailedException error = assertThrows(ComputationFailedException.class,
                () -> broken.embed(CONFIG, List.of("a")));
        assertEquals("model crashed", error.getCause().getMessage());
    }

    @Test
    void shouldPropagateStoreFailures() {
        store.failWrites = true;

        assertThrows(StoreUnavailableException.class, () -> engine.embed(CONFIG, List.of("a")));
    }

    @Test
    void shouldRejectNullSentencesBeforeAnyStoreCall() {
        List<String> sentences = new ArrayList<>(Arrays.asList("a", null));

        assertThrows(IllegalArgumentException.class, () -> engine.embed(CONFIG, sentences));
        assertTrue(store.operations.isEmpty());
    }

    @Test
    void shouldRejectConfigForAnotherBackend() {
        EmbeddingModelConfig http = new EmbeddingModelConfig(EmbeddingBackend.HTTP, "length-v1", null);

        assertThrows(IllegalArgumentException.class, () -> engine.embed(http, List.of("a")));
    }

    @Test
    void shouldTrackHitAndMissCounts() {
        engine.embed(CONFIG, List.of("a", "b", "a"));
        engine.embed(CONFIG, List.of("a", "c"));

        CacheStatistics stats = engine.statistics();
        assertEquals(2, stats.calls());
        assertEquals(5, stats.sentences());
        assertEquals(1, stats.hits());
        assertEquals(3, stats.misses());
        assertEquals(2, stats.computeRuns());
        assertEquals(0.25, stats.hitRate(), 1e-9);
    }

    @Test
    void shouldEmbedSingleSentence() {
        float[] vector = engine.embedOne(CONFIG, "four", EmbedOptions.DEFAULT);

        assertArrayEquals(new float[] { 4f }, vector);
    }

    private static class FixedEmbeddingFunction implements EmbeddingFunction {
        private final List<float[]> output;

        FixedEmbeddingFunction(List<float[]> output) {
            this.output = output;
        }

        @Override
        public List<float[]> compute(List<String> sentences, EmbeddingRequest request) {
            return output;
        }

        @Override
        public int dimension(EmbeddingRequest request) {
            return 1;
        }

        @Override
        public EmbeddingBackend backend() {
            return EmbeddingBackend.LOCAL;
        }
    }
}
