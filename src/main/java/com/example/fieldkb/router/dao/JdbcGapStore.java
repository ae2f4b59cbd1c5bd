package com.example.fieldkb.router.dao;

import com.example.fieldkb.router.error.StoreFailureException;
import com.example.fieldkb.router.model.GapRecord;
import com.example.fieldkb.router.model.GapStats;
import com.example.fieldkb.router.model.RepairRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Array;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed gap store. Deduplication relies on the unique index on
 * {@code kb_gaps.query_fingerprint} and a single {@code INSERT ... ON CONFLICT} statement.
 */
@Slf4j
public class JdbcGapStore implements GapStore {

    private static final GapRecordRowMapper ROW_MAPPER = new GapRecordRowMapper();

    private static final String UPSERT_SQL = """
            INSERT INTO kb_gaps (query_fingerprint, query_text, vendor, equipment, symptom,
                                 frequency, priority, first_seen_at, last_seen_at, resolved)
            VALUES (:fingerprint, :queryText, :vendor, :equipment, :symptom,
                    1, :priority, :now, :now, FALSE)
            ON CONFLICT (query_fingerprint) DO UPDATE
               SET frequency    = kb_gaps.frequency + 1,
                   last_seen_at = EXCLUDED.last_seen_at,
                   priority     = EXCLUDED.priority
            RETURNING
            """ + GapRecordRowMapper.COLUMNS;

    private static final String RESOLVE_SQL = """
            UPDATE kb_gaps
               SET resolved = TRUE, resolved_at = ?, resolution_refs = ?
             WHERE id = ? AND resolved = FALSE
            """;

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbc;

    public JdbcGapStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbc = new NamedParameterJdbcTemplate(jdbcTemplate);
    }

    @Override
    public GapRecord upsert(RepairRequest repair, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("fingerprint", repair.getFingerprint())
                .addValue("queryText", repair.getQueryText())
                .addValue("vendor", repair.getVendorHint())
                .addValue("equipment", repair.getEquipmentHint())
                .addValue("symptom", repair.getSymptomHint())
                .addValue("priority", repair.getPriority())
                .addValue("now", Timestamp.from(now));
        try {
            return namedJdbc.queryForObject(UPSERT_SQL, params, ROW_MAPPER);
        } catch (DataAccessException e) {
            throw new StoreFailureException("Failed to upsert kb gap " + repair.getFingerprint(), e);
        }
    }

    @Override
    public Optional<GapRecord> findByFingerprint(String fingerprint) {
        return queryOne("SELECT " + GapRecordRowMapper.COLUMNS + " FROM kb_gaps WHERE query_fingerprint = :fingerprint",
                new MapSqlParameterSource("fingerprint", fingerprint));
    }

    @Override
    public Optional<GapRecord> findById(long id) {
        return queryOne("SELECT " + GapRecordRowMapper.COLUMNS + " FROM kb_gaps WHERE id = :id",
                new MapSqlParameterSource("id", id));
    }

    @Override
    public Optional<GapRecord> markResolved(long id, List<String> resolutionRefs, Instant now) {
        List<String> refs = resolutionRefs == null ? List.of() : resolutionRefs;
        try {
            int updated = jdbcTemplate.update(con -> {
                Array refArray = con.createArrayOf("text", refs.toArray());
                var ps = con.prepareStatement(RESOLVE_SQL);
                ps.setTimestamp(1, Timestamp.from(now));
                ps.setArray(2, refArray);
                ps.setLong(3, id);
                return ps;
            });
            if (updated == 0) {
                log.debug("[gap-store] Gap {} already resolved or unknown", id);
            }
        } catch (DataAccessException e) {
            throw new StoreFailureException("Failed to resolve kb gap " + id, e);
        }
        return findById(id);
    }

    @Override
    public boolean claimResearch(long id, Instant now, Duration requeueAfter) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("now", Timestamp.from(now));
        String sql;
        if (requeueAfter == null) {
            sql = "UPDATE kb_gaps SET research_queued_at = :now WHERE id = :id AND research_queued_at IS NULL";
        } else {
            sql = """
                    UPDATE kb_gaps SET research_queued_at = :now
                     WHERE id = :id
                       AND (research_queued_at IS NULL OR research_queued_at <= :cutoff)
                    """;
            params.addValue("cutoff", Timestamp.from(now.minus(requeueAfter)));
        }
        try {
            return namedJdbc.update(sql, params) == 1;
        } catch (DataAccessException e) {
            throw new StoreFailureException("Failed to claim research for kb gap " + id, e);
        }
    }

    @Override
    public List<GapRecord> findTop(int limit, boolean resolved) {
        String sql = "SELECT " + GapRecordRowMapper.COLUMNS + """
                 FROM kb_gaps
                WHERE resolved = :resolved
                ORDER BY frequency DESC, last_seen_at DESC
                LIMIT :limit
                """;
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("resolved", resolved)
                .addValue("limit", limit);
        try {
            return namedJdbc.query(sql, params, ROW_MAPPER);
        } catch (DataAccessException e) {
            throw new StoreFailureException("Failed to list kb gaps", e);
        }
    }

    @Override
    public GapStats stats() {
        String sql = """
                SELECT COUNT(*)                                   AS total_gaps,
                       COUNT(*) FILTER (WHERE resolved = TRUE)    AS resolved_count,
                       COUNT(*) FILTER (WHERE resolved = FALSE)   AS unresolved_count,
                       AVG(frequency)                             AS avg_frequency,
                       AVG(EXTRACT(EPOCH FROM (resolved_at - first_seen_at)) / 3600) AS avg_resolution_hours
                  FROM kb_gaps
                """;
        try {
            return jdbcTemplate.queryForObject(sql, (rs, rowNum) -> {
                long total = rs.getLong("total_gaps");
                long resolved = rs.getLong("resolved_count");
                double avgFrequency = rs.getDouble("avg_frequency");
                double avgHours = rs.getDouble("avg_resolution_hours");
                Double resolutionHours = rs.wasNull() ? null : avgHours;
                return new GapStats(
                        total,
                        resolved,
                        rs.getLong("unresolved_count"),
                        total > 0 ? resolved * 100.0 / total : 0.0,
                        avgFrequency,
                        resolutionHours);
            });
        } catch (DataAccessException e) {
            throw new StoreFailureException("Failed to compute kb gap stats", e);
        }
    }

    private Optional<GapRecord> queryOne(String sql, MapSqlParameterSource params) {
        try {
            return namedJdbc.query(sql, params, ROW_MAPPER).stream().findFirst();
        } catch (DataAccessException e) {
            throw new StoreFailureException("Failed to read kb gap", e);
        }
    }
}
