package com.chommie.jobsearch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "jobsearch")
public class JobSearchProperties {
    private Store store = new Store();
    private Cache cache = new Cache();
    private Guard guard = new Guard();

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Guard getGuard() {
        return guard;
    }

    public void setGuard(Guard guard) {
        this.guard = guard;
    }

    public static class Store {
        private String mode = "jdbc";
        private String restBaseUrl = "http://localhost:54321/rest/v1";
        private String restApiKey;
        private int requestTimeoutSeconds = 10;
        private int maxRetries = 2;
        private int retryBaseDelayMs = 200;
        private int retryMaxDelayMs = 2000;
        private int batchCap = 500;
        private int maxSearchLimit = 100;
        private int defaultSearchLimit = 20;
        private int similarKeywordCount = 3;

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public String getRestBaseUrl() {
            return restBaseUrl;
        }

        public void setRestBaseUrl(String restBaseUrl) {
            this.restBaseUrl = restBaseUrl;
        }

        public String getRestApiKey() {
            return restApiKey;
        }

        public void setRestApiKey(String restApiKey) {
            this.restApiKey = restApiKey;
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(0, maxRetries);
        }

        public int getRetryBaseDelayMs() {
            return Math.max(0, retryBaseDelayMs);
        }

        public void setRetryBaseDelayMs(int retryBaseDelayMs) {
            this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
        }

        public int getRetryMaxDelayMs() {
            return Math.max(0, retryMaxDelayMs);
        }

        public void setRetryMaxDelayMs(int retryMaxDelayMs) {
            this.retryMaxDelayMs = Math.max(0, retryMaxDelayMs);
        }

        public int getBatchCap() {
            return Math.max(1, batchCap);
        }

        public void setBatchCap(int batchCap) {
            this.batchCap = Math.max(1, batchCap);
        }

        public int getMaxSearchLimit() {
            return Math.max(1, maxSearchLimit);
        }

        public void setMaxSearchLimit(int maxSearchLimit) {
            this.maxSearchLimit = Math.max(1, maxSearchLimit);
        }

        public int getDefaultSearchLimit() {
            return Math.max(1, Math.min(defaultSearchLimit, getMaxSearchLimit()));
        }

        public void setDefaultSearchLimit(int defaultSearchLimit) {
            this.defaultSearchLimit = Math.max(1, defaultSearchLimit);
        }

        public int getSimilarKeywordCount() {
            return Math.max(1, similarKeywordCount);
        }

        public void setSimilarKeywordCount(int similarKeywordCount) {
            this.similarKeywordCount = Math.max(1, similarKeywordCount);
        }
    }

    public static class Cache {
        private int maximumEntries = 10_000;
        private int compressionThresholdBytes = 1024;
        private int entityTtlSeconds = 1800;
        private int searchTtlSeconds = 300;
        private int trendingTtlSeconds = 300;
        private int similarTtlSeconds = 600;

        public int getMaximumEntries() {
            return Math.max(1, maximumEntries);
        }

        public void setMaximumEntries(int maximumEntries) {
            this.maximumEntries = Math.max(1, maximumEntries);
        }

        public int getCompressionThresholdBytes() {
            return Math.max(0, compressionThresholdBytes);
        }

        public void setCompressionThresholdBytes(int compressionThresholdBytes) {
            this.compressionThresholdBytes = Math.max(0, compressionThresholdBytes);
        }

        public int getEntityTtlSeconds() {
            return Math.max(1, entityTtlSeconds);
        }

        public void setEntityTtlSeconds(int entityTtlSeconds) {
            this.entityTtlSeconds = Math.max(1, entityTtlSeconds);
        }

        public int getSearchTtlSeconds() {
            return Math.max(1, searchTtlSeconds);
        }

        public void setSearchTtlSeconds(int searchTtlSeconds) {
            this.searchTtlSeconds = Math.max(1, searchTtlSeconds);
        }

        public int getTrendingTtlSeconds() {
            return Math.max(1, trendingTtlSeconds);
        }

        public void setTrendingTtlSeconds(int trendingTtlSeconds) {
            this.trendingTtlSeconds = Math.max(1, trendingTtlSeconds);
        }

        public int getSimilarTtlSeconds() {
            return Math.max(1, similarTtlSeconds);
        }

        public void setSimilarTtlSeconds(int similarTtlSeconds) {
            this.similarTtlSeconds = Math.max(1, similarTtlSeconds);
        }
    }

    public static class Guard {
        private Policy login = new Policy(5, 900);
        private Policy search = new Policy(60, 60);

        public Policy getLogin() {
            return login;
        }

        public void setLogin(Policy login) {
            this.login = login;
        }

        public Policy getSearch() {
            return search;
        }

        public void setSearch(Policy search) {
            this.search = search;
        }
    }

    public static class Policy {
        private int maxAttempts;
        private int windowSeconds;

        public Policy() {
            this(5, 900);
        }

        public Policy(int maxAttempts, int windowSeconds) {
            this.maxAttempts = maxAttempts;
            this.windowSeconds = windowSeconds;
        }

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public int getWindowSeconds() {
            return Math.max(1, windowSeconds);
        }

        public void setWindowSeconds(int windowSeconds) {
            this.windowSeconds = Math.max(1, windowSeconds);
        }
    }
}
