package com.netcourier.enrichment.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    /**
     * Overall budget for one document; enrichment still running at expiry is cancelled.
     */
    @NotNull
    private Duration documentDeadline = Duration.ofMinutes(30);

    /**
     * Time granted to embedding and storage once enrichment has ended, even past the document deadline.
     */
    @NotNull
    private Duration completionGrace = Duration.ofMinutes(5);

    /**
     * Language assumed when detection cannot decide.
     */
    @NotBlank
    private String defaultLanguage = "de";

    /**
     * Vector store collection receiving the chunk records.
     */
    @NotBlank
    private String collection = "rag_documents";

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Stages stages = new Stages();

    @Valid
    private Structuring structuring = new Structuring();

    @Valid
    private Annotation annotation = new Annotation();

    @Valid
    private Chunking chunking = new Chunking();

    @Valid
    private Enrichment enrichment = new Enrichment();

    @Valid
    private Embedding embedding = new Embedding();

    public Duration getDocumentDeadline() {
        return documentDeadline;
    }

    public void setDocumentDeadline(Duration documentDeadline) {
        this.documentDeadline = documentDeadline;
    }

    public Duration getCompletionGrace() {
        return completionGrace;
    }

    public void setCompletionGrace(Duration completionGrace) {
        this.completionGrace = completionGrace;
    }

    public String getDefaultLanguage() {
        return defaultLanguage;
    }

    public void setDefaultLanguage(String defaultLanguage) {
        this.defaultLanguage = defaultLanguage;
    }

    public String getCollection() {
        return collection;
    }

    public void setCollection(String collection) {
        this.collection = collection;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Stages getStages() {
        return stages;
    }

    public void setStages(Stages stages) {
        this.stages = stages;
    }

    public Structuring getStructuring() {
        return structuring;
    }

    public void setStructuring(Structuring structuring) {
        this.structuring = structuring;
    }

    public Annotation getAnnotation() {
        return annotation;
    }

    public void setAnnotation(Annotation annotation) {
        this.annotation = annotation;
    }

    public Chunking getChunking() {
        return chunking;
    }

    public void setChunking(Chunking chunking) {
        this.chunking = chunking;
    }

    public Enrichment getEnrichment() {
        return enrichment;
    }

    public void setEnrichment(Enrichment enrichment) {
        this.enrichment = enrichment;
    }

    public Embedding getEmbedding() {
        return embedding;
    }

    public void setEmbedding(Embedding embedding) {
        this.embedding = embedding;
    }

    public static class Retry {

        /**
         * Total attempts per stage call, including the first one.
         */
        @Min(1)
        private int maxAttempts = 3;

        @NotNull
        private Duration initialBackoff = Duration.ofMillis(500);

        @DecimalMin("1.0")
        private double multiplier = 2.0;

        @NotNull
        private Duration maxBackoff = Duration.ofSeconds(10);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }
    }

    public static class Stages {

        @Valid
        private Endpoint languageDetection = new Endpoint("http://127.0.0.1:8000", "/detect-language", Duration.ofSeconds(60));

        @Valid
        private Endpoint structuring = new Endpoint("http://127.0.0.1:8001", "/structure-pdf/", Duration.ofMinutes(5));

        @Valid
        private Endpoint annotation = new Endpoint("http://127.0.0.1:8002", "/process/", Duration.ofMinutes(2));

        @Valid
        private Endpoint enrichment = new Endpoint("http://127.0.0.1:8003", "/enrich-text/", Duration.ofMinutes(15));

        @Valid
        private Endpoint embedding = new Endpoint("http://127.0.0.1:8004", "/embed", Duration.ofMinutes(10));

        @Valid
        private Endpoint vectorStore = new Endpoint("http://127.0.0.1:6333", "/collections", Duration.ofSeconds(30));

        public Endpoint getLanguageDetection() {
            return languageDetection;
        }

        public void setLanguageDetection(Endpoint languageDetection) {
            this.languageDetection = languageDetection;
        }

        public Endpoint getStructuring() {
            return structuring;
        }

        public void setStructuring(Endpoint structuring) {
            this.structuring = structuring;
        }

        public Endpoint getAnnotation() {
            return annotation;
        }

        public void setAnnotation(Endpoint annotation) {
            this.annotation = annotation;
        }

        public Endpoint getEnrichment() {
            return enrichment;
        }

        public void setEnrichment(Endpoint enrichment) {
            this.enrichment = enrichment;
        }

        public Endpoint getEmbedding() {
            return embedding;
        }

        public void setEmbedding(Endpoint embedding) {
            this.embedding = embedding;
        }

        public Endpoint getVectorStore() {
            return vectorStore;
        }

        public void setVectorStore(Endpoint vectorStore) {
            this.vectorStore = vectorStore;
        }
    }

    public static class Endpoint {

        @NotBlank
        private String baseUrl;

        @NotBlank
        private String path;

        @NotNull
        private Duration timeout;

        public Endpoint() {
        }

        public Endpoint(String baseUrl, String path, Duration timeout) {
            this.baseUrl = baseUrl;
            this.path = path;
            this.timeout = timeout;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Structuring {

        /**
         * Layout element types whose text makes up the structured document text.
         */
        @NotEmpty
        private List<String> textTypes = List.of("NarrativeText", "UncategorizedText", "ListItem", "Title");

        public List<String> getTextTypes() {
            return textTypes;
        }

        public void setTextTypes(List<String> textTypes) {
            this.textTypes = textTypes;
        }
    }

    public static class Annotation {

        /**
         * Annotation model per language code; languages without an entry let the stage decide.
         */
        private Map<String, String> models = new HashMap<>(Map.of(
                "de", "de_core_news_sm",
                "en", "en_core_web_sm"));

        public Map<String, String> getModels() {
            return models;
        }

        public void setModels(Map<String, String> models) {
            this.models = models;
        }
    }

    public static class Chunking {

        /**
         * Upper bound, in characters, of the text window sent to one semantic-chunking call.
         */
        @Min(200)
        private int windowSize = 4000;

        public int getWindowSize() {
            return windowSize;
        }

        public void setWindowSize(int windowSize) {
            this.windowSize = windowSize;
        }
    }

    public static class Enrichment {

        @Min(1)
        private int workerLimit = 4;

        /**
         * Extra generations requested when the output cannot be recovered.
         */
        @Min(0)
        private int regenerationAttempts = 1;

        public int getWorkerLimit() {
            return workerLimit;
        }

        public void setWorkerLimit(int workerLimit) {
            this.workerLimit = workerLimit;
        }

        public int getRegenerationAttempts() {
            return regenerationAttempts;
        }

        public void setRegenerationAttempts(int regenerationAttempts) {
            this.regenerationAttempts = regenerationAttempts;
        }
    }

    public static class Embedding {

        @Min(1)
        private int batchSize = 16;

        private String passagePrefix = "passage: ";

        private String queryPrefix = "query: ";

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public String getPassagePrefix() {
            return passagePrefix;
        }

        public void setPassagePrefix(String passagePrefix) {
            this.passagePrefix = passagePrefix;
        }

        public String getQueryPrefix() {
            return queryPrefix;
        }

        public void setQueryPrefix(String queryPrefix) {
            this.queryPrefix = queryPrefix;
        }
    }
}
