package com.example.fieldkb.router.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

import com.example.fieldkb.router.config.RouterProperties;
import com.example.fieldkb.router.dao.InMemoryResearchQueue;
import com.example.fieldkb.router.dao.OutboxEvent;
import com.example.fieldkb.router.dao.ResearchQueue;
import com.example.fieldkb.router.error.EnqueueFailureException;
import com.example.fieldkb.router.model.GapRecord;
import com.example.fieldkb.router.model.RepairRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class ResearchTriggerTest {

  private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final RouterProperties properties = new RouterProperties();

  private static RepairRequest repair() {
    return RepairRequest.builder()
        .fingerprint("fp-1")
        .queryText("siemens g120c drive fault f0003")
        .vendorHint("siemens")
        .equipmentHint("drive")
        .searchTerms(List.of("G120C manual", "G120C F0003 fault code", "site:siemens.com G120C", "siemens drive manual"))
        .priority(70)
        .build();
  }

  private static GapRecord gap(Long id) {
    return GapRecord.builder().id(id).queryFingerprint("fp-1").frequency(1).build();
  }

  @Test
  void publishesResearchMessageToOutbox() throws Exception {
    InMemoryResearchQueue queue = new InMemoryResearchQueue();
    ResearchTrigger trigger = new ResearchTrigger(queue, objectMapper, properties, CLOCK);

    assertThat(trigger.enqueue(repair(), gap(12L))).isTrue();

    assertThat(queue.events()).hasSize(1);
    OutboxEvent event = queue.events().get(0);
    assertThat(event.eventType()).isEqualTo("kb.research.requested");
    assertThat(event.aggregateType()).isEqualTo("kb_gap");
    assertThat(event.aggregateId()).isEqualTo("12");
    assertThat(event.status()).isEqualTo("NEW");
    assertThat(event.dedupKey()).hasSize(64);

    JsonNode payload = objectMapper.readTree(event.payloadJson());
    assertThat(payload.get("gap_id").asLong()).isEqualTo(12L);
    assertThat(payload.get("priority").asInt()).isEqualTo(70);
    assertThat(payload.get("vendor_hint").asText()).isEqualTo("siemens");
    assertThat(payload.get("equipment_hint").asText()).isEqualTo("drive");
    assertThat(payload.get("search_terms")).hasSize(4);
  }

  @Test
  void secondEnqueueInSameWindowIsDeduplicated() {
    InMemoryResearchQueue queue = new InMemoryResearchQueue();
    ResearchTrigger trigger = new ResearchTrigger(queue, objectMapper, properties, CLOCK);

    assertThat(trigger.enqueue(repair(), gap(12L))).isTrue();
    assertThat(trigger.enqueue(repair(), gap(12L))).isFalse();
    assertThat(queue.size()).isEqualTo(1);
  }

  @Test
  void syntheticGapIsQueuedUnderItsFingerprint() {
    InMemoryResearchQueue queue = new InMemoryResearchQueue();
    ResearchTrigger trigger = new ResearchTrigger(queue, objectMapper, properties, CLOCK);

    assertThat(trigger.enqueue(repair(), gap(null))).isTrue();
    assertThat(queue.events().get(0).aggregateId()).isEqualTo("fp-1");
    assertThat(queue.events().get(0).payloadJson()).contains("\"gap_id\":null");
  }

  @Test
  void queueFailureIsSwallowed() {
    ResearchQueue queue = mock(ResearchQueue.class);
    doThrow(new EnqueueFailureException("outbox unavailable")).when(queue).publish(any());
    ResearchTrigger trigger = new ResearchTrigger(queue, objectMapper, properties, CLOCK);

    assertThat(trigger.enqueue(repair(), gap(12L))).isFalse();
  }

  @Test
  void unexpectedFailureIsSwallowed() {
    ResearchQueue queue = mock(ResearchQueue.class);
    doThrow(new IllegalStateException("boom")).when(queue).publish(any());

    assertThat(new ResearchTrigger(queue, objectMapper, properties, CLOCK).enqueue(repair(), gap(12L))).isFalse();
  }

  @Test
  void windowFollowsRequeueSetting() {
    ResearchTrigger daily = new ResearchTrigger(new InMemoryResearchQueue(), objectMapper, properties, CLOCK);
    assertThat(daily.window()).isEqualTo(String.valueOf(CLOCK.millis() / Duration.ofHours(24).toMillis()));

    properties.getGap().setRequeueAfter(null);
    ResearchTrigger once = new ResearchTrigger(new InMemoryResearchQueue(), objectMapper, properties, CLOCK);
    assertThat(once.window()).isEqualTo("once");
  }
}
