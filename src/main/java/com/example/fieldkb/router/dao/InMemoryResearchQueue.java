package com.example.fieldkb.router.dao;

import org.springframework.dao.DuplicateKeyException;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/** Keeps published events in memory; used with the in-memory gap store. */
public class InMemoryResearchQueue implements ResearchQueue {

    private final ConcurrentLinkedQueue<OutboxEvent> events = new ConcurrentLinkedQueue<>();
    private final Set<String> dedupKeys = ConcurrentHashMap.newKeySet();

    @Override
    public void publish(OutboxEvent event) {
        if (!dedupKeys.add(event.dedupKey())) {
            throw new DuplicateKeyException("Outbox event already exists: " + event.dedupKey());
        }
        events.add(event);
    }

    public List<OutboxEvent> events() {
        return List.copyOf(events);
    }

    public int size() {
        return events.size();
    }
}
