package ch.so.arp.assistant;

import java.util.List;
import java.util.concurrent.Executor;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.assistant.capability.CapabilityDispatcher;
import ch.so.arp.assistant.capability.CapabilityHandler;
import ch.so.arp.assistant.capability.CodeGenerationHandler;
import ch.so.arp.assistant.capability.ImageAnalysisHandler;
import ch.so.arp.assistant.capability.KnowledgeHandler;
import ch.so.arp.assistant.capability.SummarizationHandler;
import ch.so.arp.assistant.capability.WebSearchHandler;
import ch.so.arp.assistant.chat.ChatService;
import ch.so.arp.assistant.chat.DefaultSseEmitterFactory;
import ch.so.arp.assistant.chat.SessionRegistry;
import ch.so.arp.assistant.chat.SseEmitterFactory;
import ch.so.arp.assistant.llm.GeminiClientProperties;
import ch.so.arp.assistant.llm.GeminiLlmClient;
import ch.so.arp.assistant.llm.LlmClient;
import ch.so.arp.assistant.llm.MockLlmClient;
import ch.so.arp.assistant.plan.PlanExecutor;
import ch.so.arp.assistant.plan.PlanParser;
import ch.so.arp.assistant.plan.Planner;
import ch.so.arp.assistant.retrieval.DeterministicEmbeddingProvider;
import ch.so.arp.assistant.retrieval.EmbeddingProvider;
import ch.so.arp.assistant.retrieval.EmbeddingRetrievalService;
import ch.so.arp.assistant.retrieval.TextChunker;

/**
 * Central configuration wiring planner, executor, capabilities and retrieval
 * together. It exposes a toggle that decides whether the mocked or the hosted
 * language model is used.
 */
@Configuration
@EnableConfigurationProperties({ AssistantProperties.class, GeminiClientProperties.class })
public class AssistantConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "chatExecutor")
    public Executor chatExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("chat-");
        executor.initialize();
        return executor;
    }

    @Bean
    @ConditionalOnMissingBean(name = "ingestExecutor")
    public Executor ingestExecutor(AssistantProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getRetrieval().getIngestThreads());
        executor.setMaxPoolSize(properties.getRetrieval().getIngestThreads());
        executor.setThreadNamePrefix("ingest-");
        executor.initialize();
        return executor;
    }

    @Bean
    @ConditionalOnMissingBean
    public SseEmitterFactory sseEmitterFactory(AssistantProperties properties) {
        return new DefaultSseEmitterFactory(properties.getStreamTimeoutMillis());
    }

    @Bean
    @ConditionalOnProperty(name = "assistant.llm.mock", havingValue = "true", matchIfMissing = true)
    public LlmClient mockLlmClient() {
        return new MockLlmClient();
    }

    @Bean
    @ConditionalOnProperty(name = "assistant.llm.mock", havingValue = "false")
    public LlmClient geminiLlmClient(GeminiClientProperties properties,
            ObjectProvider<RestClient.Builder> restClientBuilder) {
        return new GeminiLlmClient(properties, restClientBuilder.getIfAvailable(RestClient::builder));
    }

    @Bean
    @ConditionalOnMissingBean
    public EmbeddingProvider embeddingProvider(AssistantProperties properties) {
        return new DeterministicEmbeddingProvider(properties.getRetrieval().getEmbeddingDimensions());
    }

    @Bean
    public TextChunker textChunker(AssistantProperties properties) {
        return new TextChunker(properties.getChunking().getSize(), properties.getChunking().getOverlap());
    }

    @Bean
    public SessionRegistry sessionRegistry(EmbeddingProvider embeddingProvider, TextChunker textChunker,
            @Qualifier("ingestExecutor") Executor ingestExecutor) {
        return new SessionRegistry(
                sessionId -> new EmbeddingRetrievalService(embeddingProvider, textChunker, ingestExecutor));
    }

    @Bean
    public Planner planner(LlmClient llmClient, ObjectProvider<ObjectMapper> objectMapper) {
        return new Planner(llmClient, new PlanParser(objectMapper.getIfAvailable(ObjectMapper::new)));
    }

    @Bean
    public PlanExecutor planExecutor(AssistantProperties properties) {
        return new PlanExecutor(properties.getPlan().getFailurePolicy());
    }

    @Bean
    public CapabilityDispatcher capabilityDispatcher(LlmClient llmClient, AssistantProperties properties) {
        List<CapabilityHandler> handlers = List.of(
                new KnowledgeHandler(llmClient, properties.getRetrieval().getTopK()),
                new WebSearchHandler(llmClient),
                new CodeGenerationHandler(llmClient),
                new SummarizationHandler(llmClient),
                new ImageAnalysisHandler(llmClient));
        return new CapabilityDispatcher(handlers);
    }

    @Bean
    public ChatService chatService(Planner planner, PlanExecutor planExecutor, CapabilityDispatcher dispatcher,
            @Qualifier("chatExecutor") Executor chatExecutor) {
        return new ChatService(planner, planExecutor, dispatcher, chatExecutor);
    }
}
