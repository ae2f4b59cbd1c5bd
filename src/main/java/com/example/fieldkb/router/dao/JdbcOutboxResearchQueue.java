package com.example.fieldkb.router.dao;

import com.example.fieldkb.router.error.EnqueueFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;

/** Writes research events to the outbox table drained by the ingestion relay. */
public class JdbcOutboxResearchQueue implements ResearchQueue {

    private final JdbcTemplate jdbcTemplate;
    private final String insertSql;

    public JdbcOutboxResearchQueue(JdbcTemplate jdbcTemplate, String table) {
        this.jdbcTemplate = jdbcTemplate;
        if (table == null || !table.matches("[A-Za-z_][A-Za-z0-9_.]*")) {
            throw new IllegalArgumentException("Invalid outbox table name: " + table);
        }
        this.insertSql = "INSERT INTO " + table
            + " (event_type, aggregate_type, aggregate_id, dedup_key, payload_json, status)"
            + " VALUES (?, ?, ?, ?, ?, ?)";
    }

    @Override
    public void publish(OutboxEvent event) {
        try {
            jdbcTemplate.update(
                insertSql,
                event.eventType(),
                event.aggregateType(),
                event.aggregateId(),
                event.dedupKey(),
                event.payloadJson(),
                event.status()
            );
        } catch (DuplicateKeyException e) {
            throw e;
        } catch (DataAccessException e) {
            throw new EnqueueFailureException("Failed to write outbox event " + event.dedupKey(), e);
        }
    }
}
