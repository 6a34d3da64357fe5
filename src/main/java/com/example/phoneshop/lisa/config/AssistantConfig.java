package com.example.phoneshop.lisa.config;

import com.example.phoneshop.lisa.generation.GenerationGateway;
import com.example.phoneshop.lisa.memory.ConversationMemoryManager;
import com.example.phoneshop.lisa.prompt.PromptLibrary;
import com.example.phoneshop.lisa.retrieval.RetrievalService;
import com.example.phoneshop.lisa.router.IntentRouter;
import com.example.phoneshop.lisa.router.RouterOutputParser;
import com.example.phoneshop.lisa.service.ChatOrchestrator;
import com.example.phoneshop.lisa.service.ProductComparisonService;
import com.example.phoneshop.lisa.tools.ProductComparisonTool;
import com.example.phoneshop.lisa.tools.ProductSearchTool;
import com.example.phoneshop.lisa.tools.StoreLocatorTool;
import com.example.phoneshop.lisa.tools.ToolRegistry;
import com.example.phoneshop.lisa.validation.ValidationService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.util.List;

@Configuration
public class AssistantConfig {

    @Bean
    public IntentRouter intentRouter(GenerationGateway gateway, PromptLibrary prompts, LisaProperties props) {
        return new IntentRouter(gateway, prompts, new RouterOutputParser(), props.getRouter().getMaxRetries());
    }

    @Bean
    public ConversationMemoryManager conversationMemoryManager(GenerationGateway gateway, PromptLibrary prompts,
                                                               LisaProperties props) {
        return new ConversationMemoryManager(gateway, prompts, props.getMemory().getSummaryThreshold());
    }

    @Bean
    public ProductComparisonService productComparisonService(RetrievalService retrievalService) {
        return new ProductComparisonService(retrievalService);
    }

    @Bean
    public ChatOrchestrator chatOrchestrator(ValidationService validationService,
                                             IntentRouter intentRouter,
                                             RetrievalService retrievalService,
                                             ProductComparisonService comparisonService,
                                             ConversationMemoryManager memoryManager,
                                             GenerationGateway gateway,
                                             PromptLibrary prompts) {
        return new ChatOrchestrator(validationService, intentRouter, retrievalService, comparisonService,
                memoryManager, gateway, prompts);
    }

    @Bean
    public ToolRegistry toolRegistry(RetrievalService retrievalService,
                                     ProductComparisonService comparisonService,
                                     ResourceLoader resourceLoader,
                                     ObjectMapper objectMapper,
                                     LisaProperties props) {
        return new ToolRegistry(List.of(
                new ProductSearchTool(retrievalService).definition(),
                new ProductComparisonTool(comparisonService).definition(),
                new StoreLocatorTool(resourceLoader, objectMapper, props.getTools().getStoresLocation()).definition()));
    }
}
