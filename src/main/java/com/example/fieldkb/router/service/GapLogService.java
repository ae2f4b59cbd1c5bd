package com.example.fieldkb.router.service;

import com.example.fieldkb.router.dao.GapStore;
import com.example.fieldkb.router.model.GapRecord;
import com.example.fieldkb.router.model.GapStats;
import com.example.fieldkb.router.model.RepairRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Request-path facade over {@link GapStore}. Store failures on the repair path are logged and
 * replaced by synthetic values so a missing database never reaches the caller; the reporting
 * methods let {@link com.example.fieldkb.router.error.StoreFailureException} through.
 */
@Slf4j
@Service
public class GapLogService {

    private final GapStore store;
    private final Clock clock;

    public GapLogService(GapStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public GapRecord record(RepairRequest repair) {
        Instant now = clock.instant();
        try {
            GapRecord record = store.upsert(repair, now);
            if (record.getFrequency() == 1) {
                log.info("Logged new kb gap: gap_id={}, priority={}, query='{}'",
                        record.getId(), record.getPriority(), abbreviate(record.getQueryText()));
            } else {
                log.info("Incremented kb gap frequency: gap_id={}, frequency={}, priority={}",
                        record.getId(), record.getFrequency(), record.getPriority());
            }
            return record;
        } catch (RuntimeException ex) {
            log.warn("Failed to persist kb gap {}, continuing with synthetic record – {}",
                    repair.getFingerprint(), ex.getMessage());
            return synthetic(repair, now);
        }
    }

    public Optional<GapRecord> findByFingerprint(String fingerprint) {
        try {
            return store.findByFingerprint(fingerprint);
        } catch (RuntimeException ex) {
            log.warn("Failed to look up kb gap {} – {}", fingerprint, ex.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Decides whether research should be queued for this gap now. Synthetic records, and store
     * failures during the claim, fall through to queueing.
     */
    public boolean claimResearch(GapRecord record, Duration requeueAfter) {
        if (record.isSynthetic() || record.getId() == null) {
            return true;
        }
        try {
            return store.claimResearch(record.getId(), clock.instant(), requeueAfter);
        } catch (RuntimeException ex) {
            log.warn("Failed to claim research for kb gap {} – {}", record.getId(), ex.getMessage());
            return true;
        }
    }

    public Optional<GapRecord> markResolved(long id, List<String> resolutionRefs) {
        Optional<GapRecord> resolved = store.markResolved(id, resolutionRefs, clock.instant());
        resolved.ifPresent(r -> log.info("Marked kb gap resolved: gap_id={}, refs={}",
                id, r.getResolutionRefs().size()));
        return resolved;
    }

    public List<GapRecord> topGaps(int limit, boolean resolved) {
        return store.findTop(limit, resolved);
    }

    public GapStats stats() {
        return store.stats();
    }

    private static GapRecord synthetic(RepairRequest repair, Instant now) {
        return GapRecord.builder()
                .queryFingerprint(repair.getFingerprint())
                .queryText(repair.getQueryText())
                .vendor(repair.getVendorHint())
                .equipment(repair.getEquipmentHint())
                .symptom(repair.getSymptomHint())
                .frequency(1)
                .priority(repair.getPriority())
                .firstSeenAt(now)
                .lastSeenAt(now)
                .synthetic(true)
                .build();
    }

    private static String abbreviate(String text) {
        if (text == null) return "";
        return text.length() > 50 ? text.substring(0, 50) + "..." : text;
    }
}
