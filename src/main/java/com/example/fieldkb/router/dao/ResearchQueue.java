package com.example.fieldkb.router.dao;

/**
 * Handoff point to the external ingestion system. Returning normally means the event was
 * accepted by the queue, not that it was processed.
 */
public interface ResearchQueue {

    /**
     * @throws org.springframework.dao.DuplicateKeyException when an event with the same dedup key exists
     * @throws com.example.fieldkb.router.error.EnqueueFailureException when the queue rejects the event
     */
    void publish(OutboxEvent event);
}
