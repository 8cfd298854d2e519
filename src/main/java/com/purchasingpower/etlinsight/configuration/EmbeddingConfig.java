package com.purchasingpower.etlinsight.configuration;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Embedding model behind the semantic index.
 *
 * <p>Uses LangChain4j's Ollama client, which retries failed calls on its own.
 * Any other {@link EmbeddingModel} bean replaces it.
 */
@Slf4j
@Configuration
public class EmbeddingConfig {

    @Bean
    @ConditionalOnMissingBean
    public EmbeddingModel embeddingModel(
            @Value("${app.ollama.base-url:http://localhost:11434}") String baseUrl,
            @Value("${app.ollama.embedding-model:mxbai-embed-large}") String modelName,
            @Value("${app.ollama.timeout-seconds:60}") int timeoutSeconds,
            @Value("${app.ollama.max-retries:3}") int maxRetries) {

        log.info("Embedding model: {} at {} (timeout {}s, retries {})", modelName, baseUrl, timeoutSeconds, maxRetries);

        return OllamaEmbeddingModel.builder()
            .baseUrl(baseUrl)
            .modelName(modelName)
            .timeout(Duration.ofSeconds(timeoutSeconds))
            .maxRetries(maxRetries)
            .logRequests(false)
            .logResponses(false)
            .build();
    }
}
