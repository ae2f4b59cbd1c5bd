package com.example.fieldkb.router.dao;

import com.example.fieldkb.router.model.GapRecord;
import com.example.fieldkb.router.model.GapStats;
import com.example.fieldkb.router.model.RepairRequest;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for knowledge gaps, keyed by query fingerprint. Implementations must make
 * {@link #upsert} and {@link #claimResearch} atomic in the store itself, since several router
 * instances can write the same fingerprint at once.
 */
public interface GapStore {

    /** Inserts with frequency 1, or increments frequency and refreshes last-seen and priority. */
    GapRecord upsert(RepairRequest repair, Instant now);

    Optional<GapRecord> findByFingerprint(String fingerprint);

    Optional<GapRecord> findById(long id);

    /**
     * Marks the gap resolved. A second call on a resolved gap changes nothing. Empty when the id
     * is unknown.
     */
    Optional<GapRecord> markResolved(long id, List<String> resolutionRefs, Instant now);

    /**
     * Records that research was queued for the gap, unless that already happened less than
     * {@code requeueAfter} ago. A null window means research is queued at most once per gap.
     *
     * @return true when the caller won the claim and should enqueue
     */
    boolean claimResearch(long id, Instant now, Duration requeueAfter);

    List<GapRecord> findTop(int limit, boolean resolved);

    GapStats stats();
}
