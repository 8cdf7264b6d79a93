package com.visaeligibility.controller;

import com.visaeligibility.TestData;
import com.visaeligibility.dto.internal.CombinedVerdict;
import com.visaeligibility.model.EligibilityResult;
import com.visaeligibility.model.Outcome;
import com.visaeligibility.service.check.EligibilityCheckCoordinator;
import com.visaeligibility.service.check.EligibilityCheckOutcome;
import com.visaeligibility.service.check.VisaCheckReport;
import com.visaeligibility.service.monitoring.PerformanceMonitorService;
import com.visaeligibility.service.store.memory.InMemoryCitationRepository;
import com.visaeligibility.service.store.memory.InMemoryEligibilityResultRepository;
import com.visaeligibility.service.store.memory.InMemoryReasoningLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class EligibilityControllerTest {

    @Mock
    private EligibilityCheckCoordinator coordinator;

    private final InMemoryEligibilityResultRepository resultRepository = new InMemoryEligibilityResultRepository();

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        EligibilityController controller = new EligibilityController(
                coordinator,
                resultRepository,
                new InMemoryReasoningLogRepository(),
                new InMemoryCitationRepository(),
                new PerformanceMonitorService(TestData.properties()),
                TestData.properties());
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    private static EligibilityCheckOutcome eligibleOutcome() {
        EligibilityResult result = EligibilityResult.builder()
                .id("result-1")
                .caseId("case-001")
                .visaTypeId(TestData.VISA_ID)
                .ruleVersionId("sw-2024-04")
                .outcome(Outcome.ELIGIBLE)
                .confidence(1.0)
                .reasoningSummary("Rule engine evaluation: 3 of 3 requirements passed. Confidence: 100%.")
                .createdAt(Instant.parse("2025-06-01T10:00:00Z"))
                .build();
        return EligibilityCheckOutcome.builder()
                .result(result)
                .verdict(CombinedVerdict.builder()
                        .outcome(Outcome.ELIGIBLE).confidence(1.0).source(CombinedVerdict.Source.RULE).build())
                .aiStatus(EligibilityCheckOutcome.AiStatus.DISABLED)
                .build();
    }

    @Test
    @DisplayName("a completed check answers 200 with the per-visa result")
    void completed() throws Exception {
        when(coordinator.runChecks(eq("case-001"), anyList(), eq(LocalDate.of(2025, 6, 1)), eq(false)))
                .thenReturn(List.of(VisaCheckReport.success(TestData.VISA_ID, eligibleOutcome())));

        mockMvc.perform(post("/api/cases/case-001/eligibility")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"visaTypeIds": ["uk-skilled-worker"], "evaluationDate": "2025-06-01", "enableAiReasoning": false}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.caseId").value("case-001"))
                .andExpect(jsonPath("$.evaluationDate").value("2025-06-01"))
                .andExpect(jsonPath("$.results[0].status").value("completed"))
                .andExpect(jsonPath("$.results[0].outcome").value("eligible"))
                .andExpect(jsonPath("$.results[0].aiStatus").value("DISABLED"))
                .andExpect(jsonPath("$.results[0].error").doesNotExist());
    }

    @Test
    @DisplayName("every visa type unknown answers 404")
    void allNotFound() throws Exception {
        when(coordinator.runChecks(eq("case-001"), anyList(), any(), any()))
                .thenReturn(List.of(VisaCheckReport.failure("uk-unknown", "Visa type uk-unknown not found", true)));

        mockMvc.perform(post("/api/cases/case-001/eligibility")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"visaTypeIds\": [\"uk-unknown\"]}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.results[0].status").value("failed"))
                .andExpect(jsonPath("$.results[0].error").value("Visa type uk-unknown not found"));
    }

    @Test
    @DisplayName("a partial failure still answers 200 with the error inline")
    void partialFailure() throws Exception {
        when(coordinator.runChecks(eq("case-001"), anyList(), any(), any()))
                .thenReturn(List.of(
                        VisaCheckReport.failure("uk-student", "Failed to persist eligibility result: disk full", false),
                        VisaCheckReport.success(TestData.VISA_ID, eligibleOutcome())));

        mockMvc.perform(post("/api/cases/case-001/eligibility")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"visaTypeIds\": [\"uk-student\", \"uk-skilled-worker\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results[0].status").value("failed"))
                .andExpect(jsonPath("$.results[1].status").value("completed"));
    }

    @Test
    @DisplayName("every run failing for other reasons answers 500")
    void allFailed() throws Exception {
        when(coordinator.runChecks(eq("case-001"), anyList(), any(), any()))
                .thenReturn(List.of(VisaCheckReport.failure("uk-student", "Failed to persist", false)));

        mockMvc.perform(post("/api/cases/case-001/eligibility")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"visaTypeIds\": [\"uk-student\"]}"))
                .andExpect(status().isInternalServerError());
    }

    @Test
    @DisplayName("an empty visa type list is rejected")
    void validation() throws Exception {
        mockMvc.perform(post("/api/cases/case-001/eligibility")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"visaTypeIds\": []}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(coordinator);
    }

    @Test
    @DisplayName("citations of an unknown reasoning log answer 404")
    void unknownReasoningLog() throws Exception {
        mockMvc.perform(get("/api/reasoning-logs/missing/citations"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("stored results of a case are listed")
    void results() throws Exception {
        resultRepository.save(eligibleOutcome().getResult());

        mockMvc.perform(get("/api/cases/case-001/eligibility-results"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.results[0].outcome").value("eligible"));
    }

    @Test
    @DisplayName("performance stats are empty before any check")
    void stats() throws Exception {
        mockMvc.perform(get("/api/performance/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("No checks recorded yet"));
    }
}
