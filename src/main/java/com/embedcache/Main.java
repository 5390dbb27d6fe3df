package com.embedcache;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.embedcache.cache.CacheStatistics;
import com.embedcache.cache.CachedEmbeddingEngine;
import com.embedcache.cache.EmbedOptions;
import com.embedcache.cache.EmbeddingModelConfig;
import com.embedcache.embedding.EmbeddingFunction;
import com.embedcache.embedding.EmbeddingFunctions;
import com.embedcache.runtime.AppConfig;
import com.embedcache.store.KeyValueStore;
import com.embedcache.store.KeyValueStores;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(
        name = "embed-cache",
        mixinStandardHelpOptions = true,
        version = "embed-cache 0.1.0",
        description = "Embeds sentences through a persistent cache and prints the vectors as JSON.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "embed-cache.yml")
    Path configPath;

    @Option(names = "--backend", description = "Embedding backend: hashing, local, http")
    String backend;

    @Option(names = "--model", description = "Model identifier")
    String model;

    @Option(names = "--normalize", negatable = true, description = "L2-normalize vectors (part of the cache namespace)")
    Boolean normalize;

    @Option(names = "--truncate-dim", description = "Keep only the first N vector components")
    Integer truncateDim;

    @Option(names = "--store-url", description = "JDBC url of the cache store, or 'memory'")
    String storeUrl;

    @Parameters(arity = "0..*", description = "Sentences to embed; read one per line from stdin when omitted")
    List<String> sentences = new ArrayList<>();

    private final InputStream in;
    private final PrintStream out;
    private final ObjectMapper jsonMapper = new ObjectMapper();

    public Main() {
        this(System.in, System.out);
    }

    Main(InputStream in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(configPath).applyEnvironment(System.getenv());
        applyOverrides(config);

        EmbeddingModelConfig modelConfig;
        EmbeddingFunction embeddingFunction;
        try {
            modelConfig = EmbeddingModelConfig.from(config.getEmbedding());
            embeddingFunction = EmbeddingFunctions.create(config.getEmbedding());
        } catch (IllegalArgumentException e) {
            log.error("Invalid embedding configuration: {}", e.getMessage());
            return 2;
        }
        List<String> input = sentences.isEmpty() ? readLines(in) : sentences;
        EmbedOptions options = new EmbedOptions(config.getEmbedding().isNormalize());

        log.info("Embedding {} sentences backend={} model={} normalize={} truncateDim={}",
                input.size(),
                modelConfig.backend(),
                modelConfig.modelId(),
                options.normalize(),
                modelConfig.truncateDim() == null ? "none" : modelConfig.truncateDim());

        try (KeyValueStore store = KeyValueStores.open(config.getStore())) {
            CachedEmbeddingEngine engine = new CachedEmbeddingEngine(store, embeddingFunction);
            List<float[]> vectors = engine.embed(modelConfig, input, options);
            out.println(jsonMapper.writeValueAsString(vectors));
            CacheStatistics stats = engine.statistics();
            log.info("Cache hits={} misses={} hitRate={}",
                    stats.hits(),
                    stats.misses(),
                    String.format("%.2f", stats.hitRate()));
        } catch (EmbeddingCacheException e) {
            log.error("Embedding failed: {}", e.getMessage(), e);
            return 1;
        } catch (IllegalArgumentException e) {
            log.error("Invalid request: {}", e.getMessage());
            return 2;
        }
        return 0;
    }

    private void applyOverrides(AppConfig config) {
        AppConfig.EmbeddingConfig embedding = config.getEmbedding();
        if (backend != null) {
            embedding.setBackend(backend);
        }
        if (model != null) {
            embedding.setModel(model);
        }
        if (normalize != null) {
            embedding.setNormalize(normalize);
        }
        if (truncateDim != null) {
            embedding.setTruncateDim(truncateDim);
        }
        if (storeUrl != null) {
            config.getStore().setUrl(storeUrl);
        }
    }

    static AppConfig loadConfig(Path config) throws IOException {
        if (config == null || !Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig loaded = mapper.readValue(config.toFile(), AppConfig.class);
        return loaded == null ? new AppConfig() : loaded;
    }

    private static List<String> readLines(InputStream input) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
        List<String> lines = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            if (!line.isBlank()) {
                lines.add(line);
            }
        }
        return lines;
    }
}
