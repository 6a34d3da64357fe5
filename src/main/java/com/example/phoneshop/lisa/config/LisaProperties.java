package com.example.phoneshop.lisa.config;

import com.example.phoneshop.lisa.generation.GenerationProvider;
import com.example.phoneshop.lisa.retrieval.RerankGate;
import com.example.phoneshop.lisa.retrieval.RerankPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Binds everything under {@code lisa.*}.
 *
 * <pre>
 * lisa.retrieval.top-k=3
 * lisa.rerank.policy=TOP_K
 * lisa.cache.store=memory
 * lisa.generation.provider=gemini
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "lisa")
public class LisaProperties {

    @Valid
    private Retrieval retrieval = new Retrieval();
    @Valid
    private Rerank rerank = new Rerank();
    @Valid
    private Cache cache = new Cache();
    @Valid
    private Router router = new Router();
    @Valid
    private Memory memory = new Memory();
    @Valid
    private Generation generation = new Generation();
    @Valid
    private Embedding embedding = new Embedding();
    @Valid
    private Vector vector = new Vector();
    @Valid
    private Corpus corpus = new Corpus();
    @Valid
    private Tools tools = new Tools();
    @Valid
    private Validation validation = new Validation();

    @Data
    public static class Retrieval {
        /** Candidates requested from each index and kept after fusion. */
        @Min(1)
        private int candidateTopK = 10;
        /** Products kept after reranking. */
        @Min(1)
        private int topK = 3;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double lexicalWeight = 0.5;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double vectorWeight = 0.5;
        @NotNull
        private Duration cacheTtl = Duration.ofHours(24);
        @NotNull
        private Duration searchTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Rerank {
        private boolean enabled = false;
        @NotNull
        private RerankPolicy policy = RerankPolicy.TOP_K;
        private double threshold = 5.0;
        @Min(1)
        private int maxContentChars = 2048;
        @NotNull
        private RerankGate gate = RerankGate.ALWAYS;
        private List<String> gateKeywords = new ArrayList<>(List.of(
                "so sánh", "đánh giá", "nên mua", "khác biệt",
                "tốt hơn", "ưu điểm", "nhược điểm", "phân tích"));
        @NotNull
        private Duration cacheTtl = Duration.ofHours(24);
        /** ONNX cross-encoder model file. */
        private String modelPath;
        /** tokenizer.json matching the model. */
        private String tokenizerPath;
    }

    @Data
    public static class Cache {
        @NotNull
        private Store store = Store.MEMORY;
        @Min(1)
        private int maxEntries = 10_000;
        private String keyPrefix = "lisa:";

        public enum Store { MEMORY, REDIS }
    }

    @Data
    public static class Router {
        @Min(0)
        private int maxRetries = 2;
    }

    @Data
    public static class Memory {
        @Min(1)
        private int summaryThreshold = 10;
    }

    @Data
    public static class Generation {
        @NotNull
        private GenerationProvider provider = GenerationProvider.GEMINI;
        private String modelName = "gemini-2.5-flash";
        private String apiKey;
        private String baseUrl;
        private double temperature = 0.7;
        private double topP = 0.9;
        @NotNull
        private Duration timeout = Duration.ofSeconds(60);
        @Valid
        private Retry retry = new Retry();
    }

    @Data
    public static class Retry {
        @Min(1)
        private int maxAttempts = 3;
        @NotNull
        private Duration baseDelay = Duration.ofSeconds(2);
    }

    @Data
    public static class Embedding {
        @NotNull
        private Provider provider = Provider.OPENAI;
        private String modelName = "text-embedding-3-small";
        private String apiKey;
        private String baseUrl;

        public enum Provider { OPENAI, OLLAMA }
    }

    @Data
    public static class Vector {
        @NotNull
        private Store store = Store.MEMORY;
        /** Embeds the loaded corpus into the in-memory store at startup. */
        private boolean seedFromCorpus = false;
        @Valid
        private Pgvector pgvector = new Pgvector();

        public enum Store { MEMORY, PGVECTOR }
    }

    @Data
    public static class Pgvector {
        private String host = "localhost";
        private int port = 5432;
        private String database = "postgres";
        private String user = "postgres";
        private String password;
        private String table = "production";
        @Min(1)
        private int dimension = 1536;
    }

    @Data
    public static class Corpus {
        @NotNull
        private Source source = Source.JSON;
        /** Spring resource location of the JSON passage array. */
        private String location = "classpath:catalog/passages.json";

        public enum Source { JSON, PGVECTOR }
    }

    @Data
    public static class Tools {
        private String storesLocation = "classpath:data/stores.json";
    }

    @Data
    public static class Validation {
        /** Longer messages are truncated with a notice. */
        @Min(1)
        private int maxMessageChars = 2000;
        @Min(1)
        private int maxThreadIdChars = 128;
    }
}
