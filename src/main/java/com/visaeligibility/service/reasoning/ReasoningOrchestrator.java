package com.visaeligibility.service.reasoning;

import com.visaeligibility.config.EligibilityProperties;
import com.visaeligibility.dto.internal.ChunkFilter;
import com.visaeligibility.dto.internal.ExtractedCitation;
import com.visaeligibility.dto.internal.ModelPrompt;
import com.visaeligibility.dto.internal.ParsedVerdict;
import com.visaeligibility.dto.internal.ReasoningResult;
import com.visaeligibility.dto.internal.RuleEvaluationResult;
import com.visaeligibility.dto.internal.ScoredChunk;
import com.visaeligibility.exception.RemoteCallException;
import com.visaeligibility.model.FactValue;
import com.visaeligibility.model.VisaType;
import com.visaeligibility.service.llm.CompletionClient;
import com.visaeligibility.service.llm.CompletionResponse;
import com.visaeligibility.service.monitoring.CheckTimer;
import com.visaeligibility.service.retrieval.ContextRetriever;
import com.visaeligibility.util.PromptBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * AI reasoning over a case: retrieve reference material, ask the model for a
 * verdict and read the verdict and citations from its answer.
 *
 * <p>Remote failures are retried per {@link RemoteCallRetries}. Once a call
 * gives up, the step reports {@link ReasoningResult.Status#UNAVAILABLE}
 * instead of throwing, and the check continues on the rule verdict.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReasoningOrchestrator {

    private final ContextRetriever contextRetriever;
    private final CompletionClient completionClient;
    private final PromptBuilder promptBuilder;
    private final VerdictParser verdictParser;
    private final CitationExtractor citationExtractor;
    private final RemoteCallRetries retries;
    private final EligibilityProperties properties;

    public ReasoningResult reason(
            VisaType visaType,
            Map<String, FactValue> facts,
            RuleEvaluationResult ruleResult,
            CheckTimer timer) {

        try {
            String query = contextRetriever.buildQuery(facts, visaType.code());
            log.debug("Retrieval query: {}", query);

            List<Double> vector = retries.getEmbedding()
                    .executeSupplier(() -> contextRetriever.embed(query));
            timer.mark(CheckTimer.EMBEDDING);

            ChunkFilter filter = ChunkFilter.builder()
                    .visaCode(visaType.code())
                    .jurisdiction(visaType.jurisdiction())
                    .build();
            List<ScoredChunk> context = retries.getSearch()
                    .executeSupplier(() -> contextRetriever.search(
                            vector, filter, properties.getTopK(), properties.getMinSimilarity()));
            timer.mark(CheckTimer.SIMILARITY_SEARCH);

            ModelPrompt prompt = constructPrompt(visaType, context, ruleResult, facts);
            CompletionResponse completion = callModel(prompt);
            timer.mark(CheckTimer.MODEL_CALL);

            return interpret(prompt, completion, context);

        } catch (RemoteCallException e) {
            log.warn("AI reasoning unavailable for visa {}: {} (retryable={})",
                    visaType.code(), e.getMessage(), e.isRetryable());
            return ReasoningResult.unavailable(e.getMessage());

        } catch (RuntimeException e) {
            log.warn("AI reasoning failed for visa {}", visaType.code(), e);
            return ReasoningResult.unavailable(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    public ModelPrompt constructPrompt(
            VisaType visaType,
            List<ScoredChunk> context,
            RuleEvaluationResult ruleResult,
            Map<String, FactValue> facts) {

        return new ModelPrompt(
                promptBuilder.buildSystemPrompt(),
                promptBuilder.buildEligibilityPrompt(visaType, facts, ruleResult, context));
    }

    public CompletionResponse callModel(ModelPrompt prompt) {
        return retries.getModel()
                .executeSupplier(() -> completionClient.complete(prompt.systemPrompt(), prompt.userPrompt()));
    }

    private ReasoningResult interpret(ModelPrompt prompt, CompletionResponse completion, List<ScoredChunk> context) {
        List<String> warnings = new ArrayList<>();
        String responseText = completion.text();

        ParsedVerdict verdict = verdictParser.parse(responseText);
        Double confidence = verdict.confidence();

        if (verdict.outcome() == null) {
            warnings.add("AI verdict could not be parsed - using rule engine verdict");
        } else if (confidence == null) {
            warnings.add("AI confidence could not be parsed - AI outcome used for conflict detection only");
        }

        if (context.isEmpty()) {
            warnings.add("No reference material found for AI reasoning");
            double cap = properties.getNoContextConfidenceCap();
            if (confidence != null && confidence > cap) {
                log.info("Capping AI confidence {} to {} (no reference material)", confidence, cap);
                confidence = cap;
                warnings.add(String.format(Locale.ROOT, "AI confidence capped at %.2f without reference material", cap));
            }
        }

        List<ExtractedCitation> citations = citationExtractor.extractCitations(responseText, context);

        log.info("AI reasoning completed: outcome={}, confidence={}, {} context chunks, {} citations",
                verdict.outcome() == null ? "unknown" : verdict.outcome().getValue(),
                confidence == null ? "unknown" : String.format(Locale.ROOT, "%.2f", confidence),
                context.size(), citations.size());

        return ReasoningResult.builder()
                .status(ReasoningResult.Status.COMPLETED)
                .outcome(verdict.outcome())
                .confidence(confidence)
                .responseText(responseText)
                .prompt(promptBuilder.combine(prompt.systemPrompt(), prompt.userPrompt()))
                .modelName(completion.modelName())
                .tokenUsage(completion.tokenUsage())
                .contextChunks(context)
                .citations(citations)
                .warnings(List.copyOf(warnings))
                .build();
    }
}
