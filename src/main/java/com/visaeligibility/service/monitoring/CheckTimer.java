package com.visaeligibility.service.monitoring;

import lombok.Getter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Step timings of one eligibility check. One instance per run; not shared.
 */
public class CheckTimer {

    public static final String RULE_EVALUATION = "Rule Evaluation";
    public static final String EMBEDDING = "Embedding";
    public static final String SIMILARITY_SEARCH = "Similarity Search";
    public static final String MODEL_CALL = "Model Call";
    public static final String COMBINATION = "Combination";
    public static final String PERSISTENCE = "Persistence";

    @Getter
    private Long startTime;

    @Getter
    private Long endTime;

    private final Map<String, Long> timings = new LinkedHashMap<>();

    public void start() {
        this.startTime = System.currentTimeMillis();
        this.timings.clear();
        this.endTime = null;
    }

    public void mark(String stepName) {
        if (startTime == null) {
            start();
        }
        timings.put(stepName, System.currentTimeMillis() - startTime);
    }

    public void end() {
        this.endTime = System.currentTimeMillis();
    }

    public double getTotalTime() {
        if (startTime == null || endTime == null) {
            return 0.0;
        }
        return (endTime - startTime) / 1000.0;
    }

    public Map<String, Double> getStepDurations() {
        Map<String, Double> durations = new LinkedHashMap<>();

        long prevTime = 0L;
        for (Map.Entry<String, Long> entry : timings.entrySet()) {
            long cumulativeTime = entry.getValue();
            durations.put(entry.getKey(), (cumulativeTime - prevTime) / 1000.0);
            prevTime = cumulativeTime;
        }
        return durations;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("totalTime", getTotalTime());
        result.put("stepDurations", getStepDurations());
        result.put("timestamp", Instant.now().toString());
        return result;
    }
}
