package com.visaeligibility.service.reasoning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.visaeligibility.dto.internal.ParsedVerdict;
import com.visaeligibility.model.Outcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the outcome and confidence stated in a model answer. The JSON block
 * requested by the prompt is tried first, then the {@code OUTCOME:} and
 * {@code CONFIDENCE:} lines. Anything that cannot be read is unknown; no
 * value is ever guessed from the wording of the answer.
 */
@Slf4j
@Component
public class VerdictParser {

    private static final Pattern JSON_BLOCK =
            Pattern.compile("\\{[^{}]*(?:\\{[^{}]*\\}[^{}]*)*\\}", Pattern.DOTALL);

    private static final Pattern OUTCOME_MARKER =
            Pattern.compile("(?im)^[\\s*#>-]*OUTCOME[\\s*]*:[\\s*]*([A-Za-z_ -]+?)[\\s*.]*$");

    private static final Pattern CONFIDENCE_MARKER =
            Pattern.compile("(?im)^[\\s*#>-]*CONFIDENCE[\\s*]*:[\\s*]*(\\d*\\.?\\d+)\\s*(%?)[\\s*.]*$");

    private final ObjectMapper objectMapper = new ObjectMapper();

    public ParsedVerdict parse(String responseText) {
        ParsedVerdict verdict = new ParsedVerdict(
                extractOutcome(responseText).orElse(null),
                extractConfidence(responseText).orElse(null));

        if (!verdict.isComplete()) {
            log.warn("Model answer did not state a complete verdict (outcome={}, confidence={})",
                    verdict.outcome(), verdict.confidence());
        }
        return verdict;
    }

    public Optional<Outcome> extractOutcome(String responseText) {
        if (responseText == null || responseText.isBlank()) {
            return Optional.empty();
        }

        Optional<Outcome> fromJson = findVerdictJson(responseText)
                .map(json -> json.get("outcome"))
                .filter(JsonNode::isTextual)
                .flatMap(node -> Outcome.fromValue(node.asText()));
        if (fromJson.isPresent()) {
            return fromJson;
        }

        return lastMatch(OUTCOME_MARKER, responseText)
                .flatMap(m -> Outcome.fromValue(m.group(1)));
    }

    public Optional<Double> extractConfidence(String responseText) {
        if (responseText == null || responseText.isBlank()) {
            return Optional.empty();
        }

        Optional<Double> fromJson = findVerdictJson(responseText)
                .map(json -> json.get("confidence"))
                .flatMap(VerdictParser::confidenceOf);
        if (fromJson.isPresent()) {
            return fromJson;
        }

        return lastMatch(CONFIDENCE_MARKER, responseText)
                .flatMap(m -> toConfidence(m.group(1), !m.group(2).isEmpty()));
    }

    /**
     * The last JSON object in the text that carries an outcome or confidence field.
     */
    public Optional<JsonNode> findVerdictJson(String responseText) {
        if (responseText == null) {
            return Optional.empty();
        }
        Matcher matcher = JSON_BLOCK.matcher(responseText);
        JsonNode found = null;

        while (matcher.find()) {
            try {
                JsonNode candidate = objectMapper.readTree(matcher.group(0));
                if (candidate.isObject() && (candidate.has("outcome") || candidate.has("confidence"))) {
                    found = candidate;
                }
            } catch (JsonProcessingException e) {
                log.debug("Skipping unparsable JSON candidate: {}", e.getOriginalMessage());
            }
        }
        return Optional.ofNullable(found);
    }

    private static Optional<Double> confidenceOf(JsonNode node) {
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        if (node.isNumber()) {
            return inRange(node.doubleValue());
        }
        if (node.isTextual()) {
            String text = node.asText().trim();
            boolean percent = text.endsWith("%");
            return toConfidence(percent ? text.substring(0, text.length() - 1).trim() : text, percent);
        }
        return Optional.empty();
    }

    private static Optional<Double> toConfidence(String raw, boolean percent) {
        try {
            double value = Double.parseDouble(raw);
            return inRange(percent ? value / 100.0 : value);
        } catch (NumberFormatException e) {
            log.debug("Unreadable confidence '{}'", raw);
            return Optional.empty();
        }
    }

    private static Optional<Double> inRange(double value) {
        return value >= 0.0 && value <= 1.0 ? Optional.of(value) : Optional.empty();
    }

    private static Optional<MatchResult> lastMatch(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        MatchResult last = null;
        while (matcher.find()) {
            last = matcher.toMatchResult();
        }
        return Optional.ofNullable(last);
    }
}
