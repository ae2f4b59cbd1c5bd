package com.example.fieldkb.router.service;

import com.example.fieldkb.router.config.RouterProperties;
import com.example.fieldkb.router.util.FingerprintUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based extractor for model numbers, fault codes, vendor and equipment type. No learned
 * model is involved, so the same text always yields the same entities.
 */
@Slf4j
@Component
public class QueryEntityExtractor {

    private static final int MAX_MODEL_TOKENS = 5;
    private static final int MAX_FAULT_CODES = 3;
    private static final int MAX_SYMPTOM_CHARS = 200;

    // applied to upper-cased text
    private static final List<Pattern> MODEL_NUMBER_PATTERNS = List.of(
            Pattern.compile("\\b[A-Z]{1,3}\\d{1,2}-\\d{3,4}[A-Z]?\\b"),          // S7-1200, S7-300
            Pattern.compile("\\b\\d{4}-[A-Z]{0,2}\\d{2,4}[A-Z]{0,2}\\b"),         // 1756-L83E
            Pattern.compile("\\b[A-Z]{1,3}-?\\d{3,6}[A-Z]?\\b"),                   // G120C, PF-525
            Pattern.compile("\\b[A-Z]\\d{2,4}[A-Z]{0,2}\\b")                       // F0003, E123
    );

    private static final Pattern FAULT_CODE = Pattern.compile("\\b[FE]\\d{3,5}\\b");
    private static final Pattern LABELLED_CODE = Pattern.compile(
            "\\b(?:FAULT|ERROR|ALARM)\\s*(?:CODE)?\\s*#?\\s*([A-Z]{0,2}\\d{1,5})\\b");

    // order matters: safety before plc so "safety plc" is not read as a plain controller
    private static final Map<String, List<String>> EQUIPMENT_KEYWORDS = orderedEquipment();

    private static final List<String> SYMPTOM_KEYWORDS = List.of(
            "fault", "error", "alarm", "tripping", "trip", "not working", "won't", "wont",
            "fails", "failed", "overheating", "stopped", "noise"
    );

    private final Map<String, List<Pattern>> vendorPatterns;

    public QueryEntityExtractor(RouterProperties properties) {
        this.vendorPatterns = compileVendors(properties.getVendors());
    }

    public ExtractedEntities extract(String text) {
        if (text == null || text.isBlank()) {
            return new ExtractedEntities(List.of(), List.of(), null, null, null);
        }
        String normalized = FingerprintUtils.normalize(text);
        String upper = normalized.toUpperCase(Locale.ROOT);

        List<String> faultCodes = extractFaultCodes(upper);
        List<String> modelTokens = extractModelTokens(upper, faultCodes);
        String vendor = detectVendor(normalized);
        String equipment = detectEquipment(normalized);
        String symptom = detectSymptom(normalized);

        return new ExtractedEntities(modelTokens, faultCodes, vendor, equipment, symptom);
    }

    /** Vendor key only, for callers that need the hint without the rest of the extraction. */
    public String detectVendor(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String normalized = FingerprintUtils.normalize(text);
        String best = null;
        int bestAt = Integer.MAX_VALUE;
        for (Map.Entry<String, List<Pattern>> entry : vendorPatterns.entrySet()) {
            for (Pattern pattern : entry.getValue()) {
                Matcher m = pattern.matcher(normalized);
                if (m.find() && m.start() < bestAt) {
                    bestAt = m.start();
                    best = entry.getKey();
                }
            }
        }
        return best;
    }

    private List<String> extractModelTokens(String upper, List<String> faultCodes) {
        Set<String> seen = new HashSet<>();
        List<String> tokens = new ArrayList<>();
        for (Pattern pattern : MODEL_NUMBER_PATTERNS) {
            Matcher m = pattern.matcher(upper);
            while (m.find()) {
                String token = m.group();
                String key = token.replace(" ", "").replace("-", "");
                if (faultCodes.contains(token) || !seen.add(key)) {
                    continue;
                }
                if (isContainedInExisting(tokens, token)) {
                    continue;
                }
                tokens.add(token);
            }
        }
        return tokens.size() > MAX_MODEL_TOKENS ? tokens.subList(0, MAX_MODEL_TOKENS) : tokens;
    }

    private static boolean isContainedInExisting(List<String> tokens, String candidate) {
        for (String existing : tokens) {
            if (existing.contains(candidate)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> extractFaultCodes(String upper) {
        LinkedHashSet<String> codes = new LinkedHashSet<>();
        Matcher direct = FAULT_CODE.matcher(upper);
        while (direct.find()) {
            codes.add(direct.group());
        }
        Matcher labelled = LABELLED_CODE.matcher(upper);
        while (labelled.find()) {
            codes.add(labelled.group(1));
        }
        List<String> result = new ArrayList<>(codes);
        return result.size() > MAX_FAULT_CODES ? result.subList(0, MAX_FAULT_CODES) : result;
    }

    private static String detectEquipment(String normalized) {
        for (Map.Entry<String, List<String>> entry : EQUIPMENT_KEYWORDS.entrySet()) {
            for (String keyword : entry.getValue()) {
                if (containsWord(normalized, keyword)) {
                    return entry.getKey();
                }
            }
        }
        return null;
    }

    private static String detectSymptom(String normalized) {
        int first = -1;
        for (String keyword : SYMPTOM_KEYWORDS) {
            int idx = normalized.indexOf(keyword);
            if (idx >= 0 && (first < 0 || idx < first)) {
                first = idx;
            }
        }
        if (first < 0) {
            return null;
        }
        String tail = normalized.substring(first);
        int end = indexOfSentenceEnd(tail);
        String symptom = (end > 0 ? tail.substring(0, end) : tail).trim();
        return symptom.length() > MAX_SYMPTOM_CHARS ? symptom.substring(0, MAX_SYMPTOM_CHARS) : symptom;
    }

    private static int indexOfSentenceEnd(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '.' || c == '?' || c == '!' || c == ';') {
                return i;
            }
        }
        return -1;
    }

    private static boolean containsWord(String text, String keyword) {
        return Pattern.compile("(?<![a-z0-9])" + Pattern.quote(keyword) + "(?![a-z0-9])").matcher(text).find();
    }

    private static Map<String, List<Pattern>> compileVendors(Map<String, RouterProperties.Vendor> vendors) {
        Map<String, List<Pattern>> compiled = new LinkedHashMap<>();
        if (vendors == null) {
            return compiled;
        }
        vendors.forEach((key, vendor) -> {
            List<String> aliases = new ArrayList<>();
            aliases.add(key);
            if (vendor != null && vendor.getAliases() != null) {
                aliases.addAll(vendor.getAliases());
            }
            List<Pattern> patterns = aliases.stream()
                    .filter(a -> a != null && !a.isBlank())
                    .map(a -> a.trim().toLowerCase(Locale.ROOT))
                    .distinct()
                    .map(a -> Pattern.compile("(?<![a-z0-9])" + Pattern.quote(a) + "(?![a-z0-9])"))
                    .toList();
            compiled.put(key.toLowerCase(Locale.ROOT), patterns);
        });
        log.debug("[entity-extractor] Loaded {} vendor alias tables", compiled.size());
        return compiled;
    }

    private static Map<String, List<String>> orderedEquipment() {
        Map<String, List<String>> map = new LinkedHashMap<>();
        map.put("safety", List.of("safety relay", "e-stop", "emergency stop", "light curtain", "safety plc"));
        map.put("drive", List.of("drive", "vfd", "inverter", "frequency converter"));
        map.put("plc", List.of("plc", "controller", "cpu", "processor"));
        map.put("hmi", List.of("hmi", "panelview", "panel view", "touch panel", "display"));
        map.put("motor", List.of("motor", "servo", "stepper"));
        map.put("sensor", List.of("sensor", "encoder", "proximity", "photoelectric"));
        return Collections.unmodifiableMap(map);
    }
}
