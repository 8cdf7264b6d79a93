package com.visaeligibility.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Engine configuration bound from {@code eligibility.*}. Every section is
 * optional; the convenience getters fall back to the documented defaults.
 */
@Slf4j
@Data
@Configuration
@ConfigurationProperties(prefix = "eligibility")
public class EligibilityProperties {

    private Rules rules;
    private Combiner combiner;
    private Retrieval retrieval;
    private Reasoning reasoning;
    private Monitoring monitoring;
    private Dataset dataset;

    // ============================================================
    // Rule aggregation
    // ============================================================
    @Data
    public static class Rules {
        private Double eligibleThreshold;
        private Double possibleThreshold;
    }

    // ============================================================
    // Verdict combination
    // ============================================================
    @Data
    public static class Combiner {
        private Double escalationThreshold;
    }

    // ============================================================
    // Context retrieval
    // ============================================================
    @Data
    public static class Retrieval {
        private Integer topK;
        private Double minSimilarity;
        private Double noContextConfidenceCap;
    }

    // ============================================================
    // AI reasoning
    // ============================================================
    @Data
    public static class Reasoning {
        private Boolean enabled;
        private Integer maxAttempts;
        private Long initialBackoffMillis;
        private Double backoffMultiplier;
        private Integer summaryMaxChars;
        private Integer excerptMaxChars;
    }

    @Data
    public static class Monitoring {
        private Integer maxCheckHistory;
    }

    // ============================================================
    // Seed data for the in-memory stores
    // ============================================================
    @Data
    public static class Dataset {
        private String facts;
        private String visaTypes;
        private String ruleVersions;
        private String chunks;
    }

    // ============================================================
    // Convenience Getters
    // ============================================================

    public double getEligibleThreshold() {
        return rules != null && rules.getEligibleThreshold() != null
                ? rules.getEligibleThreshold()
                : 0.8;
    }

    public double getPossibleThreshold() {
        return rules != null && rules.getPossibleThreshold() != null
                ? rules.getPossibleThreshold()
                : 0.5;
    }

    public double getEscalationThreshold() {
        return combiner != null && combiner.getEscalationThreshold() != null
                ? combiner.getEscalationThreshold()
                : 0.6;
    }

    public int getTopK() {
        return retrieval != null && retrieval.getTopK() != null
                ? retrieval.getTopK()
                : 5;
    }

    public double getMinSimilarity() {
        return retrieval != null && retrieval.getMinSimilarity() != null
                ? retrieval.getMinSimilarity()
                : 0.7;
    }

    public double getNoContextConfidenceCap() {
        return retrieval != null && retrieval.getNoContextConfidenceCap() != null
                ? retrieval.getNoContextConfidenceCap()
                : 0.5;
    }

    public boolean isReasoningEnabled() {
        return reasoning == null || reasoning.getEnabled() == null || reasoning.getEnabled();
    }

    public int getMaxAttempts() {
        return reasoning != null && reasoning.getMaxAttempts() != null
                ? reasoning.getMaxAttempts()
                : 3;
    }

    public long getInitialBackoffMillis() {
        return reasoning != null && reasoning.getInitialBackoffMillis() != null
                ? reasoning.getInitialBackoffMillis()
                : 500L;
    }

    public double getBackoffMultiplier() {
        return reasoning != null && reasoning.getBackoffMultiplier() != null
                ? reasoning.getBackoffMultiplier()
                : 2.0;
    }

    public int getSummaryMaxChars() {
        return reasoning != null && reasoning.getSummaryMaxChars() != null
                ? reasoning.getSummaryMaxChars()
                : 500;
    }

    public int getExcerptMaxChars() {
        return reasoning != null && reasoning.getExcerptMaxChars() != null
                ? reasoning.getExcerptMaxChars()
                : 300;
    }

    public int getMaxCheckHistory() {
        return monitoring != null && monitoring.getMaxCheckHistory() != null
                ? monitoring.getMaxCheckHistory()
                : 100;
    }

    // ============================================================
    // Initialization & Logging
    // ============================================================

    @PostConstruct
    public void init() {
        log.info("=".repeat(70));
        log.info("ELIGIBILITY ENGINE CONFIGURATION");
        log.info("=".repeat(70));
        log.info("  - Eligible threshold   : {}", getEligibleThreshold());
        log.info("  - Possible threshold   : {}", getPossibleThreshold());
        log.info("  - Escalation threshold : {}", getEscalationThreshold());
        log.info("  - Retrieval top-k      : {} (min similarity {})", getTopK(), getMinSimilarity());
        log.info("  - AI reasoning enabled : {}", isReasoningEnabled());
        log.info("  - Remote call attempts : {} (backoff {}ms x{})",
                getMaxAttempts(), getInitialBackoffMillis(), getBackoffMultiplier());
        log.info("=".repeat(70));
    }
}
