package com.example.fieldkb.router.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Binds properties:
 *
 * langchain4j.openai.api-key=...
 * langchain4j.openai.chat-model=...
 * langchain4j.openai.embedding-model=...
 * langchain4j.openai.temperature=0.2
 */
@Data
@ConfigurationProperties(prefix = "langchain4j.openai")
public class Langchain4jOpenAiProperties {

    /**
     * OpenAI API key. When blank, embeddings are computed locally.
     */
    private String apiKey;

    /**
     * Chat model name, e.g. "gpt-4o-mini"
     */
    private String chatModel = "gpt-4o-mini";

    /**
     * Embedding model name, e.g. "text-embedding-3-small"
     */
    private String embeddingModel = "text-embedding-3-small";

    private double temperature = 0.2;

    private Integer maxOutputTokens = 800;

    private Duration timeout = Duration.ofSeconds(30);
}
