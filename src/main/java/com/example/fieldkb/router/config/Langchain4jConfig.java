package com.example.fieldkb.router.config;

import com.example.fieldkb.router.retrieval.EmbeddingStoreRetrievalClient;
import com.example.fieldkb.router.retrieval.RetrievalClient;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.pgvector.PgVectorEmbeddingStore;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
        Langchain4jOpenAiProperties.class,
        PgVectorProperties.class
})
public class Langchain4jConfig {

    @Bean
    public ChatModel chatModel(Langchain4jOpenAiProperties props) {
        return OpenAiChatModel.builder()
                .apiKey(props.getApiKey())
                .modelName(props.getChatModel())
                .temperature(props.getTemperature())
                .maxTokens(props.getMaxOutputTokens())
                .timeout(props.getTimeout())
                .build();
    }

    @Bean
    public EmbeddingModel embeddingModel(Langchain4jOpenAiProperties props) {
        // Local model when no key is configured; the store dimension must match
        if (props.getApiKey() == null || props.getApiKey().isBlank()) {
            return new AllMiniLmL6V2EmbeddingModel();
        }
        return OpenAiEmbeddingModel.builder()
                .apiKey(props.getApiKey())
                .modelName(props.getEmbeddingModel())
                .build();
    }

    @Bean
    public EmbeddingStore<TextSegment> embeddingStore(PgVectorProperties p) {
        return PgVectorEmbeddingStore.builder()
                .host(p.getHost())
                .port(p.getPort())
                .database(p.getDatabase())
                .user(p.getUser())
                .password(p.getPassword())
                .table(p.getTable())
                .dimension(p.getDimension())
                .createTable(false)
                .dropTableFirst(false)
                .build();
    }

    @Bean
    public RetrievalClient retrievalClient(EmbeddingModel embeddingModel,
                                           EmbeddingStore<TextSegment> embeddingStore,
                                           RouterProperties properties) {
        return new EmbeddingStoreRetrievalClient(embeddingModel, embeddingStore, properties);
    }
}
