package com.example.fieldkb.router.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.fieldkb.router.config.RouterProperties;
import com.example.fieldkb.router.error.RetrievalFailureException;
import com.example.fieldkb.router.model.MatchedItem;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchResult;
import dev.langchain4j.store.embedding.EmbeddingStore;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class EmbeddingStoreRetrievalClientTest {

  private final EmbeddingModel embeddingModel = mock(EmbeddingModel.class);
  @SuppressWarnings("unchecked")
  private final EmbeddingStore<TextSegment> embeddingStore = mock(EmbeddingStore.class);
  private final EmbeddingStoreRetrievalClient client =
      new EmbeddingStoreRetrievalClient(embeddingModel, embeddingStore, new RouterProperties());

  @Test
  void mapsMatchMetadataToItems() {
    when(embeddingModel.embed(anyString())).thenReturn(Response.from(Embedding.from(new float[] {0.1f, 0.2f})));
    Metadata metadata = new Metadata()
        .put("item_id", "kb-17")
        .put("vendor", "siemens")
        .put("equipment_type", "drive")
        .put("source", "G120C operating instructions, p. 212")
        .put("quality", 0.9);
    EmbeddingMatch<TextSegment> withMetadata =
        new EmbeddingMatch<>(0.88, "emb-1", null, TextSegment.from("F0003: undervoltage", metadata));
    EmbeddingMatch<TextSegment> bare =
        new EmbeddingMatch<>(0.41, "emb-2", null, TextSegment.from("loose text"));
    when(embeddingStore.search(any())).thenReturn(new EmbeddingSearchResult<>(List.of(withMetadata, bare)));

    List<MatchedItem> items = client.search("g120c f0003", 5, Duration.ofSeconds(2));

    assertThat(items).hasSize(2);
    MatchedItem first = items.get(0);
    assertThat(first.getItemId()).isEqualTo("kb-17");
    assertThat(first.getRelevance()).isEqualTo(0.88);
    assertThat(first.getVendor()).isEqualTo("siemens");
    assertThat(first.getEquipmentType()).isEqualTo("drive");
    assertThat(first.getQuality()).isEqualTo(0.9);
    assertThat(first.getContent()).isEqualTo("F0003: undervoltage");
    MatchedItem second = items.get(1);
    assertThat(second.getItemId()).isEqualTo("emb-2");
    assertThat(second.getQuality()).isNull();
    assertThat(second.getVendor()).isNull();
  }

  @Test
  void blankTextSkipsTheStore() {
    assertThat(client.search("  ", 5, Duration.ofSeconds(1))).isEmpty();
    verifyNoInteractions(embeddingModel, embeddingStore);
  }

  @Test
  void storeFailureBecomesRetrievalFailure() {
    when(embeddingModel.embed(anyString())).thenThrow(new IllegalStateException("connection reset"));

    assertThatThrownBy(() -> client.search("plc fault", 5, Duration.ofSeconds(1)))
        .isInstanceOf(RetrievalFailureException.class)
        .hasMessageContaining("connection reset");
  }

  @Test
  void slowStoreTimesOut() {
    when(embeddingModel.embed(anyString())).thenAnswer(invocation -> {
      Thread.sleep(1_000);
      return Response.from(Embedding.from(new float[] {0.1f}));
    });

    assertThatThrownBy(() -> client.search("plc fault", 5, Duration.ofMillis(50)))
        .isInstanceOf(RetrievalFailureException.class)
        .hasMessageContaining("timed out");
  }
}
