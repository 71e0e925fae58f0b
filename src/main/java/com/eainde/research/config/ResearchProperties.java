package com.eainde.research.config;

import com.eainde.research.llm.StagePromptConfig;
import com.eainde.research.stage.StageName;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

@Data
@Component
@ConfigurationProperties(prefix = "research")
public class ResearchProperties {

    private Pipeline pipeline = new Pipeline();
    private Cache cache = new Cache();
    private Gate gate = new Gate();
    private Memory memory = new Memory();
    private Embedding embedding = new Embedding();
    private Llm llm = new Llm();
    private Scheduler scheduler = new Scheduler();

    @Data
    public static class Pipeline {
        /** Concurrent pipeline runs. */
        private int workers = 4;
        /** Fan-out members one run executes at once. */
        private int fanOutThreads = 3;
        private int callThreads = 8;
        private Duration stageTimeout = Duration.ofSeconds(60);
        private Duration runBudget = Duration.ofMinutes(15);
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(10);
        /** {@code jdbc} or {@code memory}. */
        private String checkpointStore = "jdbc";

        /**
         * The fan-out pool is shared by all workers, so every concurrent run
         * gets its full width.
         */
        public int fanOutPoolSize() {
            return Math.max(1, workers) * Math.max(1, fanOutThreads);
        }
    }

    @Data
    public static class Cache {
        /** {@code memory} or {@code redis}. */
        private String backend = "memory";
        private String keyPrefix = "research:";
        private Duration defaultTtl = Duration.ofHours(24);
        /** Per-stage override keyed by stage name, e.g. {@code discovery: 6h}. */
        private Map<String, Duration> ttl = new HashMap<>();

        public Duration ttlFor(StageName stage) {
            return ttl.getOrDefault(stage.key(), defaultTtl);
        }
    }

    @Data
    public static class Gate {
        private double persistenceThreshold = 7.0;
        private int minTrainingSamples = 20;
        private String retrainCron = "0 0 2 * * *";
        private double learningRate = 0.1;
        private int epochs = 500;
        private double l2 = 0.01;
    }

    @Data
    public static class Memory {
        private int priorInsightsLimit = 5;
        private int similarInsightsK = 5;
        private double minSimilarity = 0.7;
    }

    @Data
    public static class Embedding {
        private int dimension = 384;
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey;
        private String modelName = "text-embedding-3-small";
    }

    @Data
    public static class Llm {
        private String baseUrl = "https://openrouter.ai/api/v1";
        private String apiKey;
        private String defaultModel = "qwen/qwen-2.5-72b-instruct";
        private Duration timeout = Duration.ofSeconds(60);
        private Map<StageName, StageModel> stages = new EnumMap<>(StageName.class);

        public StageModel forStage(StageName stage) {
            return stages.getOrDefault(stage, new StageModel());
        }
    }

    @Data
    public static class StageModel implements StagePromptConfig {
        private String modelName;
        private Double temperature;
        private Double topP;
        private Integer maxOutputTokens;
        private boolean jsonMode = true;
    }

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        private String cron = "0 0 9 * * *";
        private int batchSize = 50;
    }
}
