package com.example.fieldkb.router.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds everything under {@code router.*}. Each component receives the nested section it needs
 * through its constructor, so tests can build the components with tuned values directly.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "router")
public class RouterProperties {

    private final Coverage coverage = new Coverage();
    private final Scoring scoring = new Scoring();
    private final Retrieval retrieval = new Retrieval();
    private final Handler handler = new Handler();
    private final Gap gap = new Gap();
    private final Validation validation = new Validation();
    private final Map<String, Vendor> vendors = new LinkedHashMap<>(defaultVendors());

    /** Confidence thresholds used to classify coverage. */
    @Data
    public static class Coverage {
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double strong = 0.80;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double moderate = 0.60;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double thin = 0.40;
    }

    @Data
    public static class Scoring {
        private double similarityWeight = 0.40;
        private double countWeight = 0.20;
        private double qualityWeight = 0.25;
        private double breadthWeight = 0.15;
        /** Top matches averaged for the similarity signal, also the saturation point of the count signal. */
        @Min(1)
        private int topK = 5;
        private double neutralQuality = 0.5;
        private double neutralBreadth = 0.5;
    }

    @Data
    public static class Retrieval {
        @Min(1)
        private int maxResults = 8;
        private Duration timeout = Duration.ofSeconds(3);
        private double minScore = 0.0;
    }

    @Data
    public static class Handler {
        private Duration timeout = Duration.ofSeconds(20);
        private String degradedText =
                "I could not put together a detailed answer right now. Please try again in a few minutes.";
        private String escalationNotice =
                "This request was flagged for safety or urgency and has been escalated to a qualified technician. "
                        + "Do not proceed until you have been contacted.";
        private String genericPrompt =
                "You are an industrial maintenance assistant. Answer using only the provided knowledge base "
                        + "excerpts. Cite excerpts as [#n]. Say so when the excerpts do not cover the question.";
        private String fallbackPrompt =
                "You are an industrial maintenance assistant. The knowledge base has no coverage for this question. "
                        + "Give general, conservative troubleshooting guidance and say that documentation is being researched.";
        /** Specialist system prompts keyed by lowercase vendor or equipment type. */
        private final Map<String, String> specialists = new LinkedHashMap<>(Map.of(
                "siemens", "You are a Siemens automation specialist (SIMATIC S7, TIA Portal, SINAMICS drives). "
                        + "Answer using only the provided knowledge base excerpts and cite them as [#n].",
                "rockwell", "You are a Rockwell Automation / Allen-Bradley specialist (ControlLogix, CompactLogix, "
                        + "Studio 5000, PowerFlex drives). Answer using only the provided knowledge base excerpts and cite them as [#n]."
        ));
    }

    @Data
    public static class Gap {
        private boolean triggerOnThin = true;
        private int basePriority = 50;
        private int faultCodeBonus = 20;
        private int frequencyBonusPerOccurrence = 5;
        private int maxFrequencyBonus = 30;
        @Min(1)
        private int minSearchTerms = 4;
        @Min(1)
        private int maxSearchTerms = 8;
        /**
         * Minimum time between two research enqueues for the same gap. Null disables re-enqueueing
         * entirely. Fingerprint identity itself never expires.
         */
        private Duration requeueAfter = Duration.ofHours(24);
        /** {@code jdbc} or {@code memory}. */
        private String store = "jdbc";
        /** Threads of the background scheduler running gap repair. */
        @Min(1)
        private int workerThreads = 4;
        /** Repair tasks allowed to wait for a worker before new ones are rejected. */
        @Min(1)
        private int queueCapacity = 1000;
        private final Outbox outbox = new Outbox();
    }

    @Data
    public static class Outbox {
        private String eventType = "kb.research.requested";
        private String table = "research_outbox";
    }

    @Data
    public static class Validation {
        @Min(1)
        private int maxChars = 2000;
    }

    @Data
    public static class Vendor {
        private List<String> aliases = new ArrayList<>();
        private String domain;

        public static Vendor of(String domain, String... aliases) {
            Vendor vendor = new Vendor();
            vendor.setDomain(domain);
            vendor.setAliases(new ArrayList<>(List.of(aliases)));
            return vendor;
        }
    }

    private static Map<String, Vendor> defaultVendors() {
        Map<String, Vendor> vendors = new LinkedHashMap<>();
        vendors.put("siemens", Vendor.of("siemens.com", "siemens", "simatic", "sinamics", "tia portal"));
        vendors.put("rockwell", Vendor.of("rockwellautomation.com", "rockwell", "allen-bradley", "allen bradley",
                "controllogix", "compactlogix", "powerflex", "studio 5000"));
        vendors.put("abb", Vendor.of("abb.com", "abb"));
        vendors.put("schneider", Vendor.of("se.com", "schneider", "telemecanique", "modicon", "altivar"));
        vendors.put("mitsubishi", Vendor.of("mitsubishielectric.com", "mitsubishi", "melsec"));
        vendors.put("omron", Vendor.of("omron.com", "omron"));
        vendors.put("yaskawa", Vendor.of("yaskawa.com", "yaskawa"));
        vendors.put("danfoss", Vendor.of("danfoss.com", "danfoss"));
        vendors.put("fanuc", Vendor.of("fanuc.com", "fanuc"));
        return vendors;
    }
}
