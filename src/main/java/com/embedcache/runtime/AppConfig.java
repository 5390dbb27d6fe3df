package com.embedcache.runtime;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    static final String ENV_STORE_URL = "EMBEDCACHE_STORE_URL";
    static final String ENV_STORE_USER = "EMBEDCACHE_STORE_USER";
    static final String ENV_STORE_PASSWORD = "EMBEDCACHE_STORE_PASSWORD";
    static final String ENV_EMBEDDING_URL = "EMBEDCACHE_EMBEDDING_URL";
    static final String ENV_EMBEDDING_API_KEY = "EMBEDCACHE_EMBEDDING_API_KEY";

    private StoreConfig store = new StoreConfig();
    private EmbeddingConfig embedding = new EmbeddingConfig();

    public StoreConfig getStore() {
        return store;
    }

    public void setStore(StoreConfig store) {
        this.store = store == null ? new StoreConfig() : store;
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    /**
     * Overrides connection settings and secrets from environment variables when set.
     */
    public AppConfig applyEnvironment(Map<String, String> env) {
        String storeUrl = env.get(ENV_STORE_URL);
        if (storeUrl != null && !storeUrl.isBlank()) {
            store.setUrl(storeUrl);
        }
        String storeUser = env.get(ENV_STORE_USER);
        if (storeUser != null && !storeUser.isBlank()) {
            store.setUsername(storeUser);
        }
        String storePassword = env.get(ENV_STORE_PASSWORD);
        if (storePassword != null) {
            store.setPassword(storePassword);
        }
        String endpoint = env.get(ENV_EMBEDDING_URL);
        if (endpoint != null && !endpoint.isBlank()) {
            embedding.setEndpoint(endpoint);
        }
        String apiKey = env.get(ENV_EMBEDDING_API_KEY);
        if (apiKey != null && !apiKey.isBlank()) {
            embedding.setApiKey(apiKey);
        }
        return this;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StoreConfig {
        private String url = "jdbc:sqlite:.embedcache/cache.db";
        private String username;
        private String password;
        private int maximumPoolSize = 4;
        private long connectionTimeoutMs = 30000;
        private int pageSize = 1000;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public int getMaximumPoolSize() {
            return maximumPoolSize;
        }

        public void setMaximumPoolSize(int maximumPoolSize) {
            this.maximumPoolSize = maximumPoolSize;
        }

        public long getConnectionTimeoutMs() {
            return connectionTimeoutMs;
        }

        public void setConnectionTimeoutMs(long connectionTimeoutMs) {
            this.connectionTimeoutMs = connectionTimeoutMs;
        }

        public int getPageSize() {
            return pageSize;
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private String backend = "local";
        private String model = "local-trigram-v1";
        private int dimension = 384;
        private boolean normalize = false;
        private Integer truncateDim;
        private String endpoint;
        private String apiKey;
        private int timeoutMs = 30000;

        public String getBackend() {
            return backend;
        }

        public void setBackend(String backend) {
            this.backend = backend;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }

        public boolean isNormalize() {
            return normalize;
        }

        public void setNormalize(boolean normalize) {
            this.normalize = normalize;
        }

        public Integer getTruncateDim() {
            return truncateDim;
        }

        public void setTruncateDim(Integer truncateDim) {
            this.truncateDim = truncateDim;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }
}
