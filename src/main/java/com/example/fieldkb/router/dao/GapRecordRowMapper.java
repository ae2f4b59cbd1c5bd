package com.example.fieldkb.router.dao;

import com.example.fieldkb.router.model.GapRecord;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

class GapRecordRowMapper implements RowMapper<GapRecord> {

    static final String COLUMNS = """
            id, query_fingerprint, query_text, vendor, equipment, symptom,
            frequency, priority, first_seen_at, last_seen_at,
            resolved, resolved_at, resolution_refs, research_queued_at
            """;

    @Override
    public GapRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        return GapRecord.builder()
                .id(rs.getLong("id"))
                .queryFingerprint(rs.getString("query_fingerprint"))
                .queryText(rs.getString("query_text"))
                .vendor(rs.getString("vendor"))
                .equipment(rs.getString("equipment"))
                .symptom(rs.getString("symptom"))
                .frequency(rs.getInt("frequency"))
                .priority(rs.getInt("priority"))
                .firstSeenAt(toInstant(rs.getTimestamp("first_seen_at")))
                .lastSeenAt(toInstant(rs.getTimestamp("last_seen_at")))
                .resolved(rs.getBoolean("resolved"))
                .resolvedAt(toInstant(rs.getTimestamp("resolved_at")))
                .resolutionRefs(toList(rs.getArray("resolution_refs")))
                .researchQueuedAt(toInstant(rs.getTimestamp("research_queued_at")))
                .build();
    }

    private static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }

    private static List<String> toList(Array array) throws SQLException {
        if (array == null) {
            return List.of();
        }
        Object raw = array.getArray();
        List<String> values = new ArrayList<>();
        if (raw instanceof String[] strings) {
            for (String value : strings) {
                if (value != null && !value.isBlank()) {
                    values.add(value);
                }
            }
        }
        return List.copyOf(values);
    }
}
