package com.example.fieldkb.router.dao;

/** One row of the research outbox. {@code dedupKey} is unique in the table. */
public record OutboxEvent(
    String eventType,
    String aggregateType,
    String aggregateId,
    String dedupKey,
    String payloadJson,
    String status
) {
}
