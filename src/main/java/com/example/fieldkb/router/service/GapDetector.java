package com.example.fieldkb.router.service;

import com.example.fieldkb.router.config.RouterProperties;
import com.example.fieldkb.router.model.Coverage;
import com.example.fieldkb.router.model.GapRecord;
import com.example.fieldkb.router.model.QueryRequest;
import com.example.fieldkb.router.model.RepairRequest;
import com.example.fieldkb.router.util.FingerprintUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds a {@link RepairRequest} for a low-coverage request: extracted entities, 4–8 search
 * terms and a priority. Deterministic for a given text and gap history.
 */
@Slf4j
@Component
public class GapDetector {

    private static final int MAX_QUERY_CHARS = 500;

    private final QueryEntityExtractor extractor;
    private final GapLogService gapLogService;
    private final RouterProperties.Gap gap;
    private final Map<String, RouterProperties.Vendor> vendors;

    public GapDetector(QueryEntityExtractor extractor, GapLogService gapLogService, RouterProperties properties) {
        this.extractor = extractor;
        this.gapLogService = gapLogService;
        this.gap = properties.getGap();
        this.vendors = properties.getVendors();
    }

    public RepairRequest detect(QueryRequest request, Coverage coverage) {
        String normalized = FingerprintUtils.normalize(request.searchableText());
        ExtractedEntities entities = extractor.extract(normalized);
        String fingerprint = FingerprintUtils.fingerprint(normalized, entities.vendor(), entities.equipmentType());

        Optional<GapRecord> existing = gapLogService.findByFingerprint(fingerprint);
        int priority = priority(entities, existing);
        List<String> searchTerms = searchTerms(normalized, entities);

        log.debug("[gap-detector] coverage={} entities={} priority={} terms={}",
                coverage == null ? null : coverage.getLevel(), entities, priority, searchTerms.size());

        return RepairRequest.builder()
                .fingerprint(fingerprint)
                .queryText(normalized.length() > MAX_QUERY_CHARS ? normalized.substring(0, MAX_QUERY_CHARS) : normalized)
                .vendorHint(entities.vendor())
                .equipmentHint(entities.equipmentType())
                .symptomHint(entities.symptom())
                .searchTerms(searchTerms)
                .priority(priority)
                .build();
    }

    int priority(ExtractedEntities entities, Optional<GapRecord> existing) {
        int priority = gap.getBasePriority();
        if (entities.hasFaultCode()) {
            priority += gap.getFaultCodeBonus();
        }
        if (existing.isPresent()) {
            int bonus = existing.get().getFrequency() * gap.getFrequencyBonusPerOccurrence();
            priority += Math.min(bonus, gap.getMaxFrequencyBonus());
        }
        return Math.max(0, Math.min(100, priority));
    }

    List<String> searchTerms(String normalized, ExtractedEntities entities) {
        if (entities.isEmpty()) {
            return List.of(normalized);
        }

        String vendor = entities.vendor();
        String equipment = entities.equipmentType();
        String subject = subject(entities);
        LinkedHashSet<String> terms = new LinkedHashSet<>();

        for (String token : entities.modelTokens()) {
            terms.add(token + " manual");
            terms.add(token + " troubleshooting guide");
        }
        for (String code : entities.faultCodes()) {
            String prefix = subject.equals(code) ? "" : subject + " ";
            terms.add(prefix + code + " fault code");
        }
        String domain = vendorDomain(vendor);
        if (domain != null) {
            terms.add("site:" + domain + " " + (subject.equals(vendor) ? "technical documentation" : subject));
        }
        if (vendor != null && equipment != null) {
            terms.add(vendor + " " + equipment + " manual");
        }
        if (terms.isEmpty()) {
            terms.add(subject + " manual");
        }

        List<String> padding = List.of(" datasheet", " service bulletin", " wiring diagram", " troubleshooting guide");
        for (String suffix : padding) {
            if (terms.size() >= gap.getMinSearchTerms()) break;
            terms.add(subject + suffix);
        }

        List<String> result = new ArrayList<>(terms);
        int max = Math.max(gap.getMinSearchTerms(), gap.getMaxSearchTerms());
        return result.size() > max ? List.copyOf(result.subList(0, max)) : List.copyOf(result);
    }

    private static String subject(ExtractedEntities entities) {
        if (!entities.modelTokens().isEmpty()) {
            return entities.modelTokens().get(0);
        }
        String vendor = entities.vendor();
        String equipment = entities.equipmentType();
        if (vendor != null && equipment != null) {
            return vendor + " " + equipment;
        }
        if (vendor != null) {
            return vendor;
        }
        if (equipment != null) {
            return equipment;
        }
        return entities.faultCodes().get(0);
    }

    private String vendorDomain(String vendor) {
        if (vendor == null || vendors == null) {
            return null;
        }
        RouterProperties.Vendor def = vendors.get(vendor);
        return def == null || def.getDomain() == null || def.getDomain().isBlank() ? null : def.getDomain();
    }
}
