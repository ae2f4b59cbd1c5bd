package com.example.fieldkb.router.retrieval;

import com.example.fieldkb.router.config.RouterProperties;
import com.example.fieldkb.router.error.RetrievalFailureException;
import com.example.fieldkb.router.model.MatchedItem;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Searches the knowledge-item vector store. Item metadata keys follow the ingestion pipeline:
 * {@code item_id}, {@code vendor}, {@code equipment_type}, {@code source}, {@code quality}.
 */
@Slf4j
public class EmbeddingStoreRetrievalClient implements RetrievalClient {

    private final EmbeddingModel embeddingModel;
    private final EmbeddingStore<TextSegment> embeddingStore;
    private final double minScore;

    public EmbeddingStoreRetrievalClient(EmbeddingModel embeddingModel,
                                         EmbeddingStore<TextSegment> embeddingStore,
                                         RouterProperties properties) {
        this.embeddingModel = embeddingModel;
        this.embeddingStore = embeddingStore;
        this.minScore = properties.getRetrieval().getMinScore();
    }

    @Override
    public List<MatchedItem> search(String text, int k, Duration timeout) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        try {
            return Mono.fromCallable(() -> doSearch(text, k))
                    .subscribeOn(Schedulers.boundedElastic())
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException ex) {
            Throwable cause = Exceptions.unwrap(ex);
            if (cause instanceof TimeoutException) {
                throw new RetrievalFailureException("Retrieval timed out after " + timeout.toMillis() + " ms", cause);
            }
            throw new RetrievalFailureException("Retrieval failed: " + cause.getMessage(), cause);
        }
    }

    private List<MatchedItem> doSearch(String text, int k) {
        Embedding query = embeddingModel.embed(text).content();
        EmbeddingSearchRequest request = EmbeddingSearchRequest.builder()
                .queryEmbedding(query)
                .maxResults(Math.max(1, k))
                .minScore(minScore)
                .build();
        List<EmbeddingMatch<TextSegment>> matches = embeddingStore.search(request).matches();
        log.debug("[retrieval] {} matches for text='{}'", matches.size(), text);
        return matches.stream()
                .filter(Objects::nonNull)
                .map(EmbeddingStoreRetrievalClient::toItem)
                .toList();
    }

    private static MatchedItem toItem(EmbeddingMatch<TextSegment> match) {
        TextSegment segment = match.embedded();
        Metadata metadata = segment == null ? new Metadata() : segment.metadata();
        String itemId = metadata.getString("item_id");
        return MatchedItem.builder()
                .itemId(itemId != null ? itemId : match.embeddingId())
                .relevance(match.score() == null ? 0.0 : match.score())
                .vendor(metadata.getString("vendor"))
                .equipmentType(metadata.getString("equipment_type"))
                .sourceRef(metadata.getString("source"))
                .quality(metadata.getDouble("quality"))
                .content(segment == null ? null : segment.text())
                .build();
    }
}
