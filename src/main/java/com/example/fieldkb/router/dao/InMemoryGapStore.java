package com.example.fieldkb.router.dao;

import com.example.fieldkb.router.model.GapRecord;
import com.example.fieldkb.router.model.GapStats;
import com.example.fieldkb.router.model.RepairRequest;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-process gap store. Atomicity per fingerprint comes from {@link ConcurrentMap#compute};
 * only suitable when one router instance owns the data (local runs, tests).
 */
public class InMemoryGapStore implements GapStore {

    private final ConcurrentMap<String, GapRecord> byFingerprint = new ConcurrentHashMap<>();
    private final ConcurrentMap<Long, String> fingerprintById = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public GapRecord upsert(RepairRequest repair, Instant now) {
        GapRecord record = byFingerprint.compute(repair.getFingerprint(), (fp, existing) -> {
            if (existing == null) {
                return GapRecord.builder()
                        .id(sequence.incrementAndGet())
                        .queryFingerprint(fp)
                        .queryText(repair.getQueryText())
                        .vendor(repair.getVendorHint())
                        .equipment(repair.getEquipmentHint())
                        .symptom(repair.getSymptomHint())
                        .frequency(1)
                        .priority(repair.getPriority())
                        .firstSeenAt(now)
                        .lastSeenAt(now)
                        .build();
            }
            return existing.toBuilder()
                    .frequency(existing.getFrequency() + 1)
                    .priority(repair.getPriority())
                    .lastSeenAt(now)
                    .build();
        });
        fingerprintById.putIfAbsent(record.getId(), record.getQueryFingerprint());
        return record;
    }

    @Override
    public Optional<GapRecord> findByFingerprint(String fingerprint) {
        if (fingerprint == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byFingerprint.get(fingerprint));
    }

    @Override
    public Optional<GapRecord> findById(long id) {
        String fingerprint = fingerprintById.get(id);
        return fingerprint == null ? Optional.empty() : findByFingerprint(fingerprint);
    }

    @Override
    public Optional<GapRecord> markResolved(long id, List<String> resolutionRefs, Instant now) {
        String fingerprint = fingerprintById.get(id);
        if (fingerprint == null) {
            return Optional.empty();
        }
        List<String> refs = resolutionRefs == null ? List.of() : List.copyOf(resolutionRefs);
        return Optional.ofNullable(byFingerprint.computeIfPresent(fingerprint, (fp, existing) -> {
            if (existing.isResolved()) {
                return existing;
            }
            return existing.toBuilder()
                    .resolved(true)
                    .resolvedAt(now)
                    .resolutionRefs(refs)
                    .build();
        }));
    }

    @Override
    public boolean claimResearch(long id, Instant now, Duration requeueAfter) {
        String fingerprint = fingerprintById.get(id);
        if (fingerprint == null) {
            return false;
        }
        AtomicBoolean claimed = new AtomicBoolean(false);
        byFingerprint.computeIfPresent(fingerprint, (fp, existing) -> {
            Instant queuedAt = existing.getResearchQueuedAt();
            boolean due = queuedAt == null
                    || (requeueAfter != null && !queuedAt.plus(requeueAfter).isAfter(now));
            if (!due) {
                return existing;
            }
            claimed.set(true);
            return existing.toBuilder().researchQueuedAt(now).build();
        });
        return claimed.get();
    }

    @Override
    public List<GapRecord> findTop(int limit, boolean resolved) {
        return byFingerprint.values().stream()
                .filter(r -> r.isResolved() == resolved)
                .sorted(Comparator.comparingInt(GapRecord::getFrequency).reversed()
                        .thenComparing(GapRecord::getLastSeenAt, Comparator.reverseOrder()))
                .limit(Math.max(0, limit))
                .toList();
    }

    @Override
    public GapStats stats() {
        List<GapRecord> all = List.copyOf(byFingerprint.values());
        if (all.isEmpty()) {
            return GapStats.empty();
        }
        long resolved = all.stream().filter(GapRecord::isResolved).count();
        double avgFrequency = all.stream().mapToInt(GapRecord::getFrequency).average().orElse(0.0);
        OptionalDouble resolutionHours = all.stream()
                .filter(r -> r.isResolved() && r.getResolvedAt() != null && r.getFirstSeenAt() != null)
                .mapToDouble(r -> Duration.between(r.getFirstSeenAt(), r.getResolvedAt()).toMillis() / 3_600_000.0)
                .average();
        Double avgResolutionHours = resolutionHours.isPresent() ? resolutionHours.getAsDouble() : null;
        return new GapStats(
                all.size(),
                resolved,
                all.size() - resolved,
                resolved * 100.0 / all.size(),
                avgFrequency,
                avgResolutionHours);
    }
}
