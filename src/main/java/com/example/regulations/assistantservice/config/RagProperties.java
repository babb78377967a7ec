// src/main/java/com/example/regulations/assistantservice/config/RagProperties.java
package com.example.regulations.assistantservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Binds the {@code app.*} tree from application.yml.
 */
@Data
@ConfigurationProperties(prefix = "app")
public class RagProperties {

    private Chunking chunking = new Chunking();
    private Embedding embedding = new Embedding();
    private Vector vector = new Vector();
    private Query query = new Query();
    private Ingestion ingestion = new Ingestion();
    private Source source = new Source();
    private Session session = new Session();
    private Llm llm = new Llm();
    private Store store = new Store();

    @Data
    public static class Chunking {
        /** Max tokens per chunk. */
        private int maxTokens = 500;
        /** Tokens shared by neighbouring chunks. */
        private int overlapTokens = 50;
    }

    @Data
    public static class Embedding {
        private String modelVersion = "nomic-embed-text";
        private int dimension = 768;
        private int batchSize = 32;
        /** Embedding batches in flight at once. */
        private int concurrency = 4;
        private int maxAttempts = 4;
        private Duration initialBackoff = Duration.ofMillis(500);
        private double backoffMultiplier = 2.0;
        private Duration batchTimeout = Duration.ofSeconds(60);
        private long cacheSize = 50_000;
    }

    @Data
    public static class Vector {
        private boolean useAtlasVector = false;
        private String indexName = "vector_index";
        /** Weight of the recency boost added to cosine similarity. */
        private double recencyWeight = 0.02;
        private double recencyHalfLifeDays = 365;
        /** Over-fetch factor for Atlas search before stale generations are dropped. */
        private int candidateMultiplier = 4;
    }

    @Data
    public static class Query {
        private int topK = 8;
        private int contextTokenBudget = 2000;
        private int historyTurns = 6;
        private Duration timeout = Duration.ofSeconds(90);
        /** Short names users type, mapped to agency ids, e.g. EPA -> environmental-protection-agency. */
        private Map<String, String> agencyAliases = new LinkedHashMap<>();
    }

    @Data
    public static class Ingestion {
        private String cron = "0 0 6 * * *";
        /** How far back the very first run looks. */
        private int initialLookbackDays = 1;
        private int processingConcurrency = 4;
    }

    @Data
    public static class Source {
        private String baseUrl = "https://www.federalregister.gov/api/v1/documents.json";
        private String sinceParam = "conditions[publication_date][gte]";
        private String untilParam = "conditions[publication_date][lte]";
        private int pageSize = 100;
        private Duration pageDelay = Duration.ofMillis(500);
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private double backoffMultiplier = 2.0;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(30);
        /** Download raw_text_url for each document instead of indexing the abstract only. */
        private boolean fetchFullText = false;
    }

    @Data
    public static class Session {
        private Duration timeout = Duration.ofHours(1);
        private int maxHistory = 20;
    }

    @Data
    public static class Llm {
        private int concurrency = 4;
    }

    @Data
    public static class Store {
        /** mongo or memory. */
        private String type = "mongo";
    }
}
