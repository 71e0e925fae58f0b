package com.eainde.research.config;

import com.eainde.research.thread.MdcAwareThreadPoolExecutor;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.util.concurrent.ExecutorService;

@Configuration
@EnableScheduling
@RequiredArgsConstructor
public class PipelineConfig {

    private final ResearchProperties properties;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Runs whole pipelines, one signal per task. */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService pipelineWorkerExecutor() {
        return new MdcAwareThreadPoolExecutor("pipeline-worker", properties.getPipeline().getWorkers());
    }

    /** Executes individual stage calls so a hung call can be abandoned after its timeout. */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService stageCallExecutor() {
        return new MdcAwareThreadPoolExecutor("stage-call", properties.getPipeline().getCallThreads());
    }

    /** Fan-out members of all concurrent runs. */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService fanOutExecutor() {
        return new MdcAwareThreadPoolExecutor("fan-out", properties.getPipeline().fanOutPoolSize());
    }

    @Bean
    public ChatModel chatModel() {
        ResearchProperties.Llm llm = properties.getLlm();
        return OpenAiChatModel.builder()
                .baseUrl(llm.getBaseUrl())
                .apiKey(llm.getApiKey())
                .modelName(llm.getDefaultModel())
                .timeout(llm.getTimeout())
                // retries are owned by the stage executor
                .maxRetries(0)
                .build();
    }

    @Bean
    public EmbeddingModel embeddingModel() {
        ResearchProperties.Embedding embedding = properties.getEmbedding();
        return OpenAiEmbeddingModel.builder()
                .baseUrl(embedding.getBaseUrl())
                .apiKey(embedding.getApiKey())
                .modelName(embedding.getModelName())
                .dimensions(embedding.getDimension())
                .build();
    }
}
