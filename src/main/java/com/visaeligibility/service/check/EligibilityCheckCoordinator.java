package com.visaeligibility.service.check;

import com.visaeligibility.config.EligibilityProperties;
import com.visaeligibility.dto.internal.CombinedVerdict;
import com.visaeligibility.dto.internal.ExtractedCitation;
import com.visaeligibility.dto.internal.ReasoningResult;
import com.visaeligibility.dto.internal.RuleEvaluationResult;
import com.visaeligibility.exception.EligibilityCheckException;
import com.visaeligibility.exception.PersistenceException;
import com.visaeligibility.exception.VisaTypeNotFoundException;
import com.visaeligibility.model.Citation;
import com.visaeligibility.model.EligibilityResult;
import com.visaeligibility.model.FactValue;
import com.visaeligibility.model.ReasoningLog;
import com.visaeligibility.model.VisaType;
import com.visaeligibility.service.combiner.OutcomeCombiner;
import com.visaeligibility.service.monitoring.CheckTimer;
import com.visaeligibility.service.monitoring.PerformanceMonitorService;
import com.visaeligibility.service.reasoning.ReasoningOrchestrator;
import com.visaeligibility.service.rules.RuleEvaluationEngine;
import com.visaeligibility.service.rules.RuleVersionCache;
import com.visaeligibility.service.rules.RuleVersionSelection;
import com.visaeligibility.service.store.CaseFactsProvider;
import com.visaeligibility.service.store.CaseStatusGateway;
import com.visaeligibility.service.store.CitationRepository;
import com.visaeligibility.service.store.EligibilityResultRepository;
import com.visaeligibility.service.store.HumanReviewGateway;
import com.visaeligibility.service.store.ReasoningLogRepository;
import com.visaeligibility.service.store.VisaCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runs eligibility checks. Each (case, visa type) pair is an independent run
 * through {@link CheckState}: rules first, then optional AI reasoning, then
 * combination, persistence and escalation.
 *
 * <p>A run either returns a complete {@link EligibilityCheckOutcome} or throws
 * {@link EligibilityCheckException}. AI failures never fail a run; a missing
 * visa type or rule version and persistence failures always do.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EligibilityCheckCoordinator {

    static final String WARNING_AI_UNAVAILABLE = "AI reasoning unavailable - using rule engine only";
    static final String WARNING_NO_FACTS = "Case has no facts";

    private final CaseFactsProvider caseFactsProvider;
    private final VisaCatalog visaCatalog;
    private final RuleEvaluationEngine ruleEngine;
    private final ReasoningOrchestrator reasoningOrchestrator;
    private final OutcomeCombiner outcomeCombiner;
    private final EligibilityResultRepository resultRepository;
    private final ReasoningLogRepository reasoningLogRepository;
    private final CitationRepository citationRepository;
    private final HumanReviewGateway humanReviewGateway;
    private final CaseStatusGateway caseStatusGateway;
    private final PerformanceMonitorService performanceMonitor;
    private final EligibilityProperties properties;
    private final Clock clock;

    /**
     * Checks several visa types for one case, one after the other. A failed
     * run is reported in its own entry and does not stop the others.
     */
    public List<VisaCheckReport> runChecks(String caseId, List<String> visaTypeIds,
                                           LocalDate evaluationDate, Boolean enableAiReasoning) {
        List<VisaCheckReport> reports = new ArrayList<>(visaTypeIds.size());

        for (String visaTypeId : visaTypeIds) {
            try {
                EligibilityCheckOutcome outcome = runCheck(
                        new EligibilityCheckCommand(caseId, visaTypeId, evaluationDate, enableAiReasoning));
                reports.add(VisaCheckReport.success(visaTypeId, outcome));
            } catch (EligibilityCheckException e) {
                reports.add(VisaCheckReport.failure(visaTypeId, e.getMessage(), e.isNotFound()));
            }
        }
        return reports;
    }

    public EligibilityCheckOutcome runCheck(EligibilityCheckCommand command) {
        String caseId = command.caseId();
        String visaTypeId = command.visaTypeId();
        LocalDate asOf = command.evaluationDate() != null ? command.evaluationDate() : LocalDate.now(clock);

        CheckRun run = new CheckRun(caseId, visaTypeId);
        CheckTimer timer = new CheckTimer();
        timer.start();
        List<String> warnings = new ArrayList<>();

        log.info("Eligibility check started: case={}, visaType={}, asOf={}", caseId, visaTypeId, asOf);

        try {
            // ================= RULES =================
            VisaType visaType = visaCatalog.findVisaType(visaTypeId)
                    .orElseThrow(() -> new VisaTypeNotFoundException(visaTypeId));

            Map<String, FactValue> facts = caseFactsProvider.getFacts(caseId);
            if (facts.isEmpty()) {
                log.warn("Case {} has no facts", caseId);
                warnings.add(WARNING_NO_FACTS);
            }

            RuleVersionSelection selection = ruleEngine.loadActiveRuleVersion(visaTypeId, asOf, new RuleVersionCache());
            if (selection.isAmbiguous()) {
                warnings.add("Multiple active rule versions " + selection.competingVersionIds()
                        + " - using " + selection.ruleVersion().id());
            }

            RuleEvaluationResult ruleResult = ruleEngine.evaluate(selection.ruleVersion(), facts);
            if (!ruleResult.getErrors().isEmpty()) {
                warnings.add("Requirements could not be evaluated: " + ruleResult.getErrors());
            }
            timer.mark(CheckTimer.RULE_EVALUATION);
            run.moveTo(CheckState.RULE_EVALUATED);

            // ================= AI =================
            ReasoningResult reasoning = null;
            EligibilityCheckOutcome.AiStatus aiStatus;

            if (!isAiEnabled(command)) {
                aiStatus = EligibilityCheckOutcome.AiStatus.DISABLED;
                run.moveTo(CheckState.AI_SKIPPED);
            } else {
                reasoning = reasoningOrchestrator.reason(visaType, facts, ruleResult, timer);
                if (reasoning.isCompleted()) {
                    aiStatus = EligibilityCheckOutcome.AiStatus.COMPLETED;
                    warnings.addAll(reasoning.getWarnings());
                    run.moveTo(CheckState.AI_EVALUATED);
                } else {
                    log.warn("Case {} visa {}: {} ({})", caseId, visaTypeId,
                            WARNING_AI_UNAVAILABLE, reasoning.getFailureReason());
                    aiStatus = EligibilityCheckOutcome.AiStatus.UNAVAILABLE;
                    warnings.add(WARNING_AI_UNAVAILABLE);
                    run.moveTo(CheckState.AI_SKIPPED);
                }
            }

            // ================= COMBINE =================
            CombinedVerdict verdict = outcomeCombiner.combine(ruleResult, reasoning);
            timer.mark(CheckTimer.COMBINATION);
            run.moveTo(CheckState.COMBINED);

            // ================= PERSIST =================
            Persisted persisted = persist(caseId, visaTypeId, ruleResult, reasoning, verdict);
            timer.mark(CheckTimer.PERSISTENCE);
            run.moveTo(CheckState.PERSISTED);

            // ================= NOTIFY =================
            if (verdict.isEscalate()) {
                requestReview(caseId, verdict.getEscalationReason(), warnings);
            }
            markEvaluated(caseId, warnings);
            run.moveTo(verdict.isEscalate() ? CheckState.ESCALATED : CheckState.DONE);

            timer.end();
            performanceMonitor.addCheck(caseId, visaTypeId, verdict.getOutcome().getValue(), aiStatus.name(), timer);

            log.info("Eligibility check finished: case={}, visaType={}, outcome={}, confidence={}, ai={}, escalated={} ({}s)",
                    caseId, visaTypeId, verdict.getOutcome().getValue(),
                    String.format(Locale.ROOT, "%.2f", verdict.getConfidence()),
                    aiStatus, verdict.isEscalate(), timer.getTotalTime());

            return EligibilityCheckOutcome.builder()
                    .result(persisted.result())
                    .ruleEvaluation(ruleResult)
                    .reasoning(reasoning)
                    .verdict(verdict)
                    .aiStatus(aiStatus)
                    .escalated(verdict.isEscalate())
                    .reasoningLogId(persisted.reasoningLogId())
                    .citations(persisted.citations())
                    .states(run.getTrail())
                    .warnings(List.copyOf(warnings))
                    .build();

        } catch (PersistenceException e) {
            run.fail();
            log.error("Eligibility check for case {} visa {} could not be persisted", caseId, visaTypeId, e);
            throw new EligibilityCheckException(caseId, visaTypeId, "Failed to persist eligibility result: " + e.getMessage(), e);

        } catch (EligibilityCheckException e) {
            run.fail();
            throw e;

        } catch (RuntimeException e) {
            run.fail();
            log.error("Eligibility check failed for case {} visa {}: {}", caseId, visaTypeId, e.getMessage());
            throw new EligibilityCheckException(caseId, visaTypeId, e.getMessage(), e);
        }
    }

    private boolean isAiEnabled(EligibilityCheckCommand command) {
        return properties.isReasoningEnabled() && !Boolean.FALSE.equals(command.enableAiReasoning());
    }

    private Persisted persist(String caseId, String visaTypeId, RuleEvaluationResult ruleResult,
                              ReasoningResult reasoning, CombinedVerdict verdict) {
        try {
            Instant now = clock.instant();
            String reasoningLogId = null;
            List<Citation> citations = List.of();

            if (reasoning != null && reasoning.isCompleted()) {
                ReasoningLog savedLog = reasoningLogRepository.save(ReasoningLog.builder()
                        .caseId(caseId)
                        .prompt(reasoning.getPrompt())
                        .responseText(reasoning.getResponseText())
                        .modelName(reasoning.getModelName())
                        .tokenUsage(reasoning.getTokenUsage())
                        .createdAt(now)
                        .build());
                reasoningLogId = savedLog.getId();
                citations = citationRepository.saveAll(toCitations(reasoningLogId, reasoning.getCitations()));
            }

            EligibilityResult result;
            try {
                result = resultRepository.save(EligibilityResult.builder()
                        .caseId(caseId)
                        .visaTypeId(visaTypeId)
                        .ruleVersionId(ruleResult.getRuleVersionId())
                        .outcome(verdict.getOutcome())
                        .confidence(verdict.getConfidence())
                        .reasoningSummary(verdict.getReasoningSummary())
                        .missingFacts(ruleResult.getMissingFacts())
                        .reasoningLogId(reasoningLogId)
                        .createdAt(now)
                        .build());
            } catch (RuntimeException e) {
                removeReasoningLog(reasoningLogId, e);
                throw e;
            }

            return new Persisted(result, reasoningLogId, citations);

        } catch (PersistenceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PersistenceException(e.getMessage(), e);
        }
    }

    /**
     * Removes the log and citations written ahead of a result that could not
     * be stored. A failed removal is attached to the original failure.
     */
    private void removeReasoningLog(String reasoningLogId, RuntimeException failure) {
        if (reasoningLogId == null) {
            return;
        }
        try {
            citationRepository.deleteByReasoningLogId(reasoningLogId);
            reasoningLogRepository.deleteById(reasoningLogId);
            log.info("Removed reasoning log {} after failed result write", reasoningLogId);
        } catch (RuntimeException cleanupFailure) {
            log.error("Could not remove reasoning log {} after failed result write", reasoningLogId, cleanupFailure);
            failure.addSuppressed(cleanupFailure);
        }
    }

    private static List<Citation> toCitations(String reasoningLogId, List<ExtractedCitation> extracted) {
        return extracted.stream()
                .map(c -> Citation.builder()
                        .reasoningLogId(reasoningLogId)
                        .documentVersionId(c.getDocumentVersionId())
                        .chunkId(c.getChunkId())
                        .excerpt(c.getExcerpt())
                        .relevanceScore(c.getRelevanceScore())
                        .build())
                .toList();
    }

    private void requestReview(String caseId, String reason, List<String> warnings) {
        try {
            humanReviewGateway.requestHumanReview(caseId, reason);
        } catch (RuntimeException e) {
            log.warn("Human review request for case {} failed: {}", caseId, e.getMessage());
            warnings.add("Human review request failed: " + e.getMessage());
        }
    }

    private void markEvaluated(String caseId, List<String> warnings) {
        try {
            caseStatusGateway.markCaseEvaluated(caseId);
        } catch (RuntimeException e) {
            log.warn("Could not mark case {} as evaluated: {}", caseId, e.getMessage());
            warnings.add("Case status update failed: " + e.getMessage());
        }
    }

    private record Persisted(EligibilityResult result, String reasoningLogId, List<Citation> citations) {
    }
}
