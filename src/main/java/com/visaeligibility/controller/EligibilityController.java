package com.visaeligibility.controller;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.visaeligibility.config.EligibilityProperties;
import com.visaeligibility.dto.request.EligibilityCheckRequest;
import com.visaeligibility.dto.response.EligibilityCheckResponse;
import com.visaeligibility.dto.response.VisaEligibilityReport;
import com.visaeligibility.model.EligibilityResult;
import com.visaeligibility.service.check.EligibilityCheckCoordinator;
import com.visaeligibility.service.check.EligibilityCheckOutcome;
import com.visaeligibility.service.check.VisaCheckReport;
import com.visaeligibility.service.monitoring.PerformanceMonitorService;
import com.visaeligibility.service.store.CitationRepository;
import com.visaeligibility.service.store.EligibilityResultRepository;
import com.visaeligibility.service.store.ReasoningLogRepository;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class EligibilityController {

    private final EligibilityCheckCoordinator coordinator;
    private final EligibilityResultRepository resultRepository;
    private final ReasoningLogRepository reasoningLogRepository;
    private final CitationRepository citationRepository;
    private final PerformanceMonitorService performanceMonitor;
    private final EligibilityProperties properties;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        log.debug("Health check requested");

        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "healthy");
        health.put("timestamp", Instant.now().toString());
        health.put("service", "Visa Eligibility Engine");
        health.put("features", Map.of("ai_reasoning", properties.isReasoningEnabled()));

        return ResponseEntity.ok(health);
    }

    /**
     * Runs one independent check per visa type. Responds 404 when every
     * requested visa type is unknown or has no active rule version, 500 when
     * every run failed, and 200 otherwise with per-visa errors inline.
     */
    @PostMapping("/cases/{caseId}/eligibility")
    public ResponseEntity<?> checkEligibility(
            @PathVariable String caseId,
            @Valid @RequestBody EligibilityCheckRequest request) {

        log.info("Eligibility check requested for case {}: visa types {}", caseId, request.getVisaTypeIds());

        try {
            List<VisaCheckReport> reports = coordinator.runChecks(
                    caseId,
                    request.getVisaTypeIds(),
                    request.getEvaluationDate(),
                    request.getEnableAiReasoning());

            EligibilityCheckResponse response = EligibilityCheckResponse.builder()
                    .caseId(caseId)
                    .evaluationDate(request.getEvaluationDate() == null ? null : request.getEvaluationDate().toString())
                    .results(reports.stream().map(EligibilityController::toReport).toList())
                    .build();

            boolean anySucceeded = reports.stream().anyMatch(VisaCheckReport::isSuccess);
            if (anySucceeded) {
                return ResponseEntity.ok(response);
            }
            boolean allNotFound = reports.stream().allMatch(VisaCheckReport::notFound);
            return ResponseEntity.status(allNotFound ? HttpStatus.NOT_FOUND : HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(response);

        } catch (RuntimeException e) {
            log.error("Eligibility check failed for case {}", caseId, e);
            return ResponseEntity.internalServerError()
                    .body(Map.of(
                            "error", String.valueOf(e.getMessage()),
                            "caseId", caseId));
        }
    }

    @GetMapping("/cases/{caseId}/eligibility-results")
    public ResponseEntity<?> eligibilityResults(@PathVariable String caseId) {
        List<EligibilityResult> results = resultRepository.findByCaseId(caseId);
        return ResponseEntity.ok(Map.of("caseId", caseId, "total", results.size(), "results", results));
    }

    @GetMapping("/reasoning-logs/{reasoningLogId}/citations")
    public ResponseEntity<?> citations(@PathVariable String reasoningLogId) {
        if (reasoningLogRepository.findById(reasoningLogId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        var citations = citationRepository.findByReasoningLogId(reasoningLogId);
        return ResponseEntity.ok(Map.of(
                "reasoningLogId", reasoningLogId,
                "total", citations.size(),
                "citations", citations));
    }

    // ===== PERFORMANCE MONITORING =====

    @GetMapping("/performance/stats")
    public ResponseEntity<?> performanceStats() {
        log.debug("Performance stats requested");
        return ResponseEntity.ok(performanceMonitor.getStatistics());
    }

    @GetMapping("/performance/history")
    public ResponseEntity<?> performanceHistory() {
        var history = performanceMonitor.getCheckHistory();
        return ResponseEntity.ok(Map.of("totalChecks", history.size(), "history", history));
    }

    private static VisaEligibilityReport toReport(VisaCheckReport report) {
        if (!report.isSuccess()) {
            return VisaEligibilityReport.builder()
                    .visaTypeId(report.visaTypeId())
                    .status("failed")
                    .error(report.error())
                    .build();
        }

        EligibilityCheckOutcome outcome = report.outcome();
        EligibilityResult result = outcome.getResult();
        return VisaEligibilityReport.builder()
                .visaTypeId(report.visaTypeId())
                .status("completed")
                .resultId(result.getId())
                .ruleVersionId(result.getRuleVersionId())
                .outcome(result.getOutcome())
                .confidence(result.getConfidence())
                .reasoningSummary(result.getReasoningSummary())
                .missingFacts(result.getMissingFacts())
                .conflict(outcome.getVerdict().isConflict())
                .escalated(outcome.isEscalated())
                .escalationReason(outcome.getVerdict().getEscalationReason())
                .aiStatus(outcome.getAiStatus().name())
                .reasoningLogId(outcome.getReasoningLogId())
                .citations(outcome.getCitations())
                .warnings(outcome.getWarnings())
                .build();
    }
}
