package com.visaeligibility.service.monitoring;

import com.visaeligibility.TestData;
import com.visaeligibility.config.EligibilityProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PerformanceMonitorServiceTest {

    private static CheckTimer finishedTimer() {
        CheckTimer timer = new CheckTimer();
        timer.start();
        timer.mark(CheckTimer.RULE_EVALUATION);
        timer.mark(CheckTimer.PERSISTENCE);
        timer.end();
        return timer;
    }

    @Test
    @DisplayName("statistics are empty before the first check")
    void empty() {
        PerformanceMonitorService monitor = new PerformanceMonitorService(TestData.properties());

        assertThat(monitor.getStatistics()).containsEntry("message", "No checks recorded yet");
    }

    @Test
    @DisplayName("history keeps only the most recent checks")
    void bounded() {
        EligibilityProperties properties = TestData.properties();
        EligibilityProperties.Monitoring monitoring = new EligibilityProperties.Monitoring();
        monitoring.setMaxCheckHistory(2);
        properties.setMonitoring(monitoring);
        PerformanceMonitorService monitor = new PerformanceMonitorService(properties);

        monitor.addCheck("case-1", "uk-student", "eligible", "DISABLED", finishedTimer());
        monitor.addCheck("case-2", "uk-student", "eligible", "DISABLED", finishedTimer());
        monitor.addCheck("case-3", "uk-student", "not_eligible", "COMPLETED", finishedTimer());

        assertThat(monitor.getCheckHistory())
                .extracting(PerformanceMonitorService.CheckRecord::caseId)
                .containsExactly("case-2", "case-3");
    }

    @Test
    @DisplayName("statistics aggregate total and per-step times")
    @SuppressWarnings("unchecked")
    void statistics() {
        PerformanceMonitorService monitor = new PerformanceMonitorService(TestData.properties());
        monitor.addCheck("case-1", "uk-student", "eligible", "DISABLED", finishedTimer());

        Map<String, Object> stats = monitor.getStatistics();

        assertThat(stats).containsEntry("totalChecks", 1).containsKeys("avgTotalTime", "medianTotalTime");
        assertThat((Map<String, Object>) stats.get("stepStatistics"))
                .containsKeys(CheckTimer.RULE_EVALUATION, CheckTimer.PERSISTENCE);
    }
}
