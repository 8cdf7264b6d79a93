package com.visaeligibility.service.monitoring;

import com.visaeligibility.config.EligibilityProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Rolling history of completed checks, bounded by
 * {@code eligibility.monitoring.max-check-history}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PerformanceMonitorService {

    private final EligibilityProperties properties;

    private final Deque<CheckRecord> checkHistory = new ConcurrentLinkedDeque<>();

    public void addCheck(String caseId, String visaTypeId, String outcome, String aiStatus, CheckTimer timer) {
        CheckRecord record = new CheckRecord(
                Instant.now().toString(),
                caseId,
                visaTypeId,
                outcome,
                aiStatus,
                timer.getTotalTime(),
                timer.getStepDurations());

        checkHistory.addLast(record);

        while (checkHistory.size() > properties.getMaxCheckHistory()) {
            checkHistory.pollFirst();
        }
        log.debug("Recorded check {}/{} in {}s", caseId, visaTypeId, record.totalTime());
    }

    public List<CheckRecord> getCheckHistory() {
        return List.copyOf(checkHistory);
    }

    public Map<String, Object> getStatistics() {
        List<CheckRecord> history = getCheckHistory();
        if (history.isEmpty()) {
            return Map.of("message", "No checks recorded yet");
        }

        List<Double> totalTimes = history.stream()
                .map(CheckRecord::totalTime)
                .toList();

        Map<String, List<Double>> allSteps = new HashMap<>();
        for (CheckRecord record : history) {
            for (Map.Entry<String, Double> entry : record.stepDurations().entrySet()) {
                allSteps.computeIfAbsent(entry.getKey(), k -> new ArrayList<>())
                        .add(entry.getValue());
            }
        }

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("totalChecks", history.size());
        stats.put("avgTotalTime", average(totalTimes));
        stats.put("medianTotalTime", median(totalTimes));
        stats.put("minTotalTime", Collections.min(totalTimes));
        stats.put("maxTotalTime", Collections.max(totalTimes));

        Map<String, Map<String, Double>> stepStats = new LinkedHashMap<>();
        for (Map.Entry<String, List<Double>> entry : allSteps.entrySet()) {
            List<Double> times = entry.getValue();
            Map<String, Double> stepStat = new LinkedHashMap<>();
            stepStat.put("avg", average(times));
            stepStat.put("median", median(times));
            stepStat.put("min", Collections.min(times));
            stepStat.put("max", Collections.max(times));
            stepStats.put(entry.getKey(), stepStat);
        }
        stats.put("stepStatistics", stepStats);

        return stats;
    }

    private double average(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    private double median(List<Double> values) {
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int size = sorted.size();
        if (size % 2 == 0) {
            return (sorted.get(size / 2 - 1) + sorted.get(size / 2)) / 2.0;
        }
        return sorted.get(size / 2);
    }

    public record CheckRecord(
            String timestamp,
            String caseId,
            String visaTypeId,
            String outcome,
            String aiStatus,
            Double totalTime,
            Map<String, Double> stepDurations
    ) {
    }
}
