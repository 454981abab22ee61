package com.ragsync.runtime;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.ragsync.ingest.DuplicatePolicy;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private NormalizationConfig normalization = new NormalizationConfig();
    private ChunkingConfig chunking = new ChunkingConfig();
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private DiffConfig diff = new DiffConfig();
    private SyncConfig sync = new SyncConfig();
    private HttpConfig http = new HttpConfig();
    private CollectorsConfig collectors = new CollectorsConfig();
    private StatuteSourceConfig statutes = new StatuteSourceConfig();
    private Map<String, CrawlSourceConfig> crawls = new LinkedHashMap<>();

    public NormalizationConfig getNormalization() {
        return normalization;
    }

    public void setNormalization(NormalizationConfig normalization) {
        this.normalization = normalization == null ? new NormalizationConfig() : normalization;
    }

    public ChunkingConfig getChunking() {
        return chunking;
    }

    public void setChunking(ChunkingConfig chunking) {
        this.chunking = chunking == null ? new ChunkingConfig() : chunking;
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public DiffConfig getDiff() {
        return diff;
    }

    public void setDiff(DiffConfig diff) {
        this.diff = diff == null ? new DiffConfig() : diff;
    }

    public SyncConfig getSync() {
        return sync;
    }

    public void setSync(SyncConfig sync) {
        this.sync = sync == null ? new SyncConfig() : sync;
    }

    public HttpConfig getHttp() {
        return http;
    }

    public void setHttp(HttpConfig http) {
        this.http = http == null ? new HttpConfig() : http;
    }

    public CollectorsConfig getCollectors() {
        return collectors;
    }

    public void setCollectors(CollectorsConfig collectors) {
        this.collectors = collectors == null ? new CollectorsConfig() : collectors;
    }

    public StatuteSourceConfig getStatutes() {
        return statutes;
    }

    public void setStatutes(StatuteSourceConfig statutes) {
        this.statutes = statutes == null ? new StatuteSourceConfig() : statutes;
    }

    public Map<String, CrawlSourceConfig> getCrawls() {
        return crawls;
    }

    public void setCrawls(Map<String, CrawlSourceConfig> crawls) {
        this.crawls = crawls == null ? new LinkedHashMap<>() : crawls;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class NormalizationConfig {
        private int minContentChars = 80;
        private DuplicatePolicy duplicatePolicy = DuplicatePolicy.LAST_WINS;

        public int getMinContentChars() {
            return minContentChars;
        }

        public void setMinContentChars(int minContentChars) {
            this.minContentChars = minContentChars;
        }

        public DuplicatePolicy getDuplicatePolicy() {
            return duplicatePolicy;
        }

        public void setDuplicatePolicy(DuplicatePolicy duplicatePolicy) {
            this.duplicatePolicy = duplicatePolicy == null ? DuplicatePolicy.LAST_WINS : duplicatePolicy;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChunkingConfig {
        private int maxChars = 1200;
        private int overlapChars = 200;

        public int getMaxChars() {
            return maxChars;
        }

        public void setMaxChars(int maxChars) {
            this.maxChars = maxChars;
        }

        public int getOverlapChars() {
            return overlapChars;
        }

        public void setOverlapChars(int overlapChars) {
            this.overlapChars = overlapChars;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private String provider = "http";
        private String endpoint = "http://localhost:8081/embed";
        private String apiKeyEnv = "EMBEDDING_API_KEY";
        private String model = "sentence-transformers/paraphrase-multilingual-MiniLM-L12-v2";
        private boolean normalize = true;
        private int batchSize = 64;
        private int dimension = 384;
        private int timeoutMs = 120000;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getApiKeyEnv() {
            return apiKeyEnv;
        }

        public void setApiKeyEnv(String apiKeyEnv) {
            this.apiKeyEnv = apiKeyEnv;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public boolean isNormalize() {
            return normalize;
        }

        public void setNormalize(boolean normalize) {
            this.normalize = normalize;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DiffConfig {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SyncConfig {
        private int writeBatchSize = 200;
        private boolean deactivateMissing;

        public int getWriteBatchSize() {
            return writeBatchSize;
        }

        public void setWriteBatchSize(int writeBatchSize) {
            this.writeBatchSize = writeBatchSize;
        }

        public boolean isDeactivateMissing() {
            return deactivateMissing;
        }

        public void setDeactivateMissing(boolean deactivateMissing) {
            this.deactivateMissing = deactivateMissing;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class HttpConfig {
        private String userAgent = "rag-sync/0.1 (+https://example.invalid)";
        private int timeoutMs = 30000;
        private int maxRetries = 2;
        private long retryBackoffMs = 1000;

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getRetryBackoffMs() {
            return retryBackoffMs;
        }

        public void setRetryBackoffMs(long retryBackoffMs) {
            this.retryBackoffMs = retryBackoffMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CollectorsConfig {
        private int parallelism = 2;
        private long timeoutMinutes = 180;

        public int getParallelism() {
            return parallelism;
        }

        public void setParallelism(int parallelism) {
            this.parallelism = parallelism;
        }

        public long getTimeoutMinutes() {
            return timeoutMinutes;
        }

        public void setTimeoutMinutes(long timeoutMinutes) {
            this.timeoutMinutes = timeoutMinutes;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StatuteSourceConfig {
        private boolean enabled;
        private String source = "egov";
        private String baseUrl = "https://elaws.e-gov.go.jp/api/1";
        private String lawUrlPrefix = "https://laws.e-gov.go.jp/law/";
        private List<String> keywords = new ArrayList<>();
        private int maxLaws = 500;
        private int category = 1;
        private List<String> exactAllow = new ArrayList<>();
        private List<String> prefixAllow = new ArrayList<>();
        private List<String> includeSuffixes = new ArrayList<>();
        private List<String> excludePhrases = new ArrayList<>();
        private double delaySeconds = 0.5;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getSource() {
            return source;
        }

        public void setSource(String source) {
            this.source = source;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getLawUrlPrefix() {
            return lawUrlPrefix;
        }

        public void setLawUrlPrefix(String lawUrlPrefix) {
            this.lawUrlPrefix = lawUrlPrefix;
        }

        public List<String> getKeywords() {
            return keywords;
        }

        public void setKeywords(List<String> keywords) {
            this.keywords = keywords == null ? new ArrayList<>() : keywords;
        }

        public int getMaxLaws() {
            return maxLaws;
        }

        public void setMaxLaws(int maxLaws) {
            this.maxLaws = maxLaws;
        }

        public int getCategory() {
            return category;
        }

        public void setCategory(int category) {
            this.category = category;
        }

        public List<String> getExactAllow() {
            return exactAllow;
        }

        public void setExactAllow(List<String> exactAllow) {
            this.exactAllow = exactAllow == null ? new ArrayList<>() : exactAllow;
        }

        public List<String> getPrefixAllow() {
            return prefixAllow;
        }

        public void setPrefixAllow(List<String> prefixAllow) {
            this.prefixAllow = prefixAllow == null ? new ArrayList<>() : prefixAllow;
        }

        public List<String> getIncludeSuffixes() {
            return includeSuffixes;
        }

        public void setIncludeSuffixes(List<String> includeSuffixes) {
            this.includeSuffixes = includeSuffixes == null ? new ArrayList<>() : includeSuffixes;
        }

        public List<String> getExcludePhrases() {
            return excludePhrases;
        }

        public void setExcludePhrases(List<String> excludePhrases) {
            this.excludePhrases = excludePhrases == null ? new ArrayList<>() : excludePhrases;
        }

        public double getDelaySeconds() {
            return delaySeconds;
        }

        public void setDelaySeconds(double delaySeconds) {
            this.delaySeconds = delaySeconds;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CrawlSourceConfig {
        private boolean enabled;
        private String source;
        private List<String> seeds = new ArrayList<>();
        private int maxPages = 100;
        private double delaySeconds = 0.6;
        private List<String> allowedPrefixes = new ArrayList<>();
        private List<String> excludeUrlRegex = new ArrayList<>();
        private List<String> skipSaveTitleRegex = new ArrayList<>();
        private List<String> skipSaveUrlRegex = new ArrayList<>();
        private Map<String, String> extra = new HashMap<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getSource() {
            return source;
        }

        public void setSource(String source) {
            this.source = source;
        }

        public List<String> getSeeds() {
            return seeds;
        }

        public void setSeeds(List<String> seeds) {
            this.seeds = seeds == null ? new ArrayList<>() : seeds;
        }

        public int getMaxPages() {
            return maxPages;
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = maxPages;
        }

        public double getDelaySeconds() {
            return delaySeconds;
        }

        public void setDelaySeconds(double delaySeconds) {
            this.delaySeconds = delaySeconds;
        }

        public List<String> getAllowedPrefixes() {
            return allowedPrefixes;
        }

        public void setAllowedPrefixes(List<String> allowedPrefixes) {
            this.allowedPrefixes = allowedPrefixes == null ? new ArrayList<>() : allowedPrefixes;
        }

        public List<String> getExcludeUrlRegex() {
            return excludeUrlRegex;
        }

        public void setExcludeUrlRegex(List<String> excludeUrlRegex) {
            this.excludeUrlRegex = excludeUrlRegex == null ? new ArrayList<>() : excludeUrlRegex;
        }

        public List<String> getSkipSaveTitleRegex() {
            return skipSaveTitleRegex;
        }

        public void setSkipSaveTitleRegex(List<String> skipSaveTitleRegex) {
            this.skipSaveTitleRegex = skipSaveTitleRegex == null ? new ArrayList<>() : skipSaveTitleRegex;
        }

        public List<String> getSkipSaveUrlRegex() {
            return skipSaveUrlRegex;
        }

        public void setSkipSaveUrlRegex(List<String> skipSaveUrlRegex) {
            this.skipSaveUrlRegex = skipSaveUrlRegex == null ? new ArrayList<>() : skipSaveUrlRegex;
        }

        public Map<String, String> getExtra() {
            return extra;
        }

        public void setExtra(Map<String, String> extra) {
            this.extra = extra == null ? new HashMap<>() : extra;
        }
    }
}
