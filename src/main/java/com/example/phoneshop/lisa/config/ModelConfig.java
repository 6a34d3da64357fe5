package com.example.phoneshop.lisa.config;

import com.example.phoneshop.lisa.generation.GenerationGateway;
import com.example.phoneshop.lisa.generation.LangChain4jGenerationGateway;
import com.example.phoneshop.lisa.generation.RetryPolicy;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiStreamingChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.ollama.OllamaStreamingChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chat, streaming and embedding models. The provider is picked once here from configuration;
 * nothing downstream knows which one is in use.
 */
@Slf4j
@Configuration
public class ModelConfig {

    private static final String DEFAULT_OLLAMA_URL = "http://localhost:11434";

    @Bean
    public RetryPolicy generationRetryPolicy(LisaProperties props) {
        LisaProperties.Retry retry = props.getGeneration().getRetry();
        return RetryPolicy.transientFailures(retry.getMaxAttempts(), retry.getBaseDelay());
    }

    @Bean
    public ChatModel chatModel(LisaProperties props) {
        LisaProperties.Generation g = props.getGeneration();
        log.info("chat model: {} / {}", g.getProvider(), g.getModelName());
        return switch (g.getProvider()) {
            case OPENAI -> OpenAiChatModel.builder()
                    .apiKey(g.getApiKey())
                    .baseUrl(g.getBaseUrl())
                    .modelName(g.getModelName())
                    .temperature(g.getTemperature())
                    .topP(g.getTopP())
                    .timeout(g.getTimeout())
                    .build();
            case OLLAMA -> OllamaChatModel.builder()
                    .baseUrl(orDefault(g.getBaseUrl(), DEFAULT_OLLAMA_URL))
                    .modelName(g.getModelName())
                    .temperature(g.getTemperature())
                    .topP(g.getTopP())
                    .timeout(g.getTimeout())
                    .build();
            case GEMINI -> GoogleAiGeminiChatModel.builder()
                    .apiKey(g.getApiKey())
                    .modelName(g.getModelName())
                    .temperature(g.getTemperature())
                    .topP(g.getTopP())
                    .timeout(g.getTimeout())
                    .build();
        };
    }

    @Bean
    public StreamingChatModel streamingChatModel(LisaProperties props) {
        LisaProperties.Generation g = props.getGeneration();
        return switch (g.getProvider()) {
            case OPENAI -> OpenAiStreamingChatModel.builder()
                    .apiKey(g.getApiKey())
                    .baseUrl(g.getBaseUrl())
                    .modelName(g.getModelName())
                    .temperature(g.getTemperature())
                    .topP(g.getTopP())
                    .timeout(g.getTimeout())
                    .build();
            case OLLAMA -> OllamaStreamingChatModel.builder()
                    .baseUrl(orDefault(g.getBaseUrl(), DEFAULT_OLLAMA_URL))
                    .modelName(g.getModelName())
                    .temperature(g.getTemperature())
                    .topP(g.getTopP())
                    .timeout(g.getTimeout())
                    .build();
            case GEMINI -> GoogleAiGeminiStreamingChatModel.builder()
                    .apiKey(g.getApiKey())
                    .modelName(g.getModelName())
                    .temperature(g.getTemperature())
                    .topP(g.getTopP())
                    .timeout(g.getTimeout())
                    .build();
        };
    }

    @Bean
    public EmbeddingModel embeddingModel(LisaProperties props) {
        LisaProperties.Embedding e = props.getEmbedding();
        log.info("embedding model: {} / {}", e.getProvider(), e.getModelName());
        return switch (e.getProvider()) {
            case OPENAI -> OpenAiEmbeddingModel.builder()
                    .apiKey(e.getApiKey())
                    .baseUrl(e.getBaseUrl())
                    .modelName(e.getModelName())
                    .build();
            case OLLAMA -> OllamaEmbeddingModel.builder()
                    .baseUrl(orDefault(e.getBaseUrl(), DEFAULT_OLLAMA_URL))
                    .modelName(e.getModelName())
                    .build();
        };
    }

    @Bean
    public GenerationGateway generationGateway(ChatModel chatModel,
                                               StreamingChatModel streamingChatModel,
                                               RetryPolicy generationRetryPolicy,
                                               LisaProperties props) {
        return new LangChain4jGenerationGateway(chatModel, streamingChatModel,
                props.getGeneration().getTimeout(), generationRetryPolicy);
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
