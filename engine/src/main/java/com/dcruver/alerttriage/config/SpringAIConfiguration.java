package com.dcruver.alerttriage.config;

import io.micrometer.observation.ObservationRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.ollama.OllamaEmbeddingModel;
import org.springframework.ai.ollama.api.OllamaApi;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.ai.ollama.management.ModelManagementOptions;
import org.springframework.ai.ollama.management.PullModelStrategy;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring AI EmbeddingModel used to embed incoming alerts, backed by Ollama.
 */
@Configuration
@Slf4j
@ConditionalOnProperty(name = "triage.embedding.enabled", havingValue = "true", matchIfMissing = true)
public class SpringAIConfiguration {

    @Value("${spring.ai.ollama.base-url:http://localhost:11434}")
    private String ollamaBaseUrl;

    @Value("${spring.ai.ollama.embedding.options.model:nomic-embed-text:latest}")
    private String embeddingModelName;

    @Bean
    public OllamaApi ollamaApi() {
        log.info("Creating OllamaApi with base URL: {}", ollamaBaseUrl);
        return OllamaApi.builder()
                .baseUrl(ollamaBaseUrl)
                .build();
    }

    @Bean
    public EmbeddingModel embeddingModel(
            OllamaApi ollamaApi,
            ObjectProvider<ObservationRegistry> observationRegistry) {
        log.info("Creating EmbeddingModel with Ollama model: {}", embeddingModelName);

        var options = OllamaOptions.builder()
                .model(embeddingModelName)
                .build();

        // Models are expected to be present in Ollama already
        var managementOptions = ModelManagementOptions.builder()
                .pullModelStrategy(PullModelStrategy.NEVER)
                .build();

        return new OllamaEmbeddingModel(ollamaApi, options,
                observationRegistry.getIfUnique(() -> ObservationRegistry.NOOP), managementOptions);
    }
}
