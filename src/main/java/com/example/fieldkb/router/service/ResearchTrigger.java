package com.example.fieldkb.router.service;

import com.example.fieldkb.router.config.RouterProperties;
import com.example.fieldkb.router.dao.OutboxEvent;
import com.example.fieldkb.router.dao.ResearchQueue;
import com.example.fieldkb.router.error.EnqueueFailureException;
import com.example.fieldkb.router.model.GapRecord;
import com.example.fieldkb.router.model.RepairRequest;
import com.example.fieldkb.router.model.ResearchMessage;
import com.example.fieldkb.router.util.FingerprintUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * Hands a research message to the ingestion queue. Returns as soon as the queue accepted the
 * message; failures are logged and dropped.
 */
@Slf4j
@Service
public class ResearchTrigger {

    static final String AGGREGATE_TYPE = "kb_gap";
    static final String STATUS_NEW = "NEW";

    private final ResearchQueue queue;
    private final ObjectMapper objectMapper;
    private final RouterProperties.Outbox outbox;
    private final Duration requeueAfter;
    private final Clock clock;

    public ResearchTrigger(ResearchQueue queue, ObjectMapper objectMapper, RouterProperties properties, Clock clock) {
        this.queue = queue;
        this.objectMapper = objectMapper;
        this.outbox = properties.getGap().getOutbox();
        this.requeueAfter = properties.getGap().getRequeueAfter();
        this.clock = clock;
    }

    /** @return true when the message was handed over */
    public boolean enqueue(RepairRequest repair, GapRecord gap) {
        ResearchMessage message = new ResearchMessage(
                gap.getId(),
                repair.getSearchTerms(),
                repair.getPriority(),
                repair.getVendorHint(),
                repair.getEquipmentHint());

        String payloadJson;
        try {
            payloadJson = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException ex) {
            log.warn("Failed to serialize research message for gap {}: {}", gap.getId(), ex.getMessage());
            return false;
        }

        String aggregateId = gap.getId() == null ? repair.getFingerprint() : String.valueOf(gap.getId());
        String dedupKey = FingerprintUtils.sha256("research:" + repair.getFingerprint() + ":" + window());
        OutboxEvent event = new OutboxEvent(
                outbox.getEventType(), AGGREGATE_TYPE, aggregateId, dedupKey, payloadJson, STATUS_NEW);
        try {
            queue.publish(event);
            log.info("Queued research for gap {}: priority={}, search_terms={}",
                    aggregateId, message.priority(), message.searchTerms().size());
            return true;
        } catch (DuplicateKeyException ex) {
            log.debug("Research event already queued: {}", dedupKey);
            return false;
        } catch (EnqueueFailureException ex) {
            log.warn("Failed to queue research for gap {}: {}", aggregateId, ex.getMessage());
            return false;
        } catch (RuntimeException ex) {
            log.warn("Unexpected failure queueing research for gap {}", aggregateId, ex);
            return false;
        }
    }

    /** One event per fingerprint per requeue window; a single event ever when re-queueing is off. */
    String window() {
        if (requeueAfter == null || requeueAfter.isZero() || requeueAfter.isNegative()) {
            return "once";
        }
        return String.valueOf(clock.millis() / requeueAfter.toMillis());
    }
}
