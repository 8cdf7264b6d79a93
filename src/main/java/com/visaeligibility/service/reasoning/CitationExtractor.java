package com.visaeligibility.service.reasoning;

import com.fasterxml.jackson.databind.JsonNode;
import com.visaeligibility.config.EligibilityProperties;
import com.visaeligibility.dto.internal.ExtractedCitation;
import com.visaeligibility.dto.internal.ScoredChunk;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps the context references in a model answer back to the chunks that were
 * in the prompt. References are 1-based: {@code [2]}, {@code [Context 2]},
 * {@code Context 2}, or the {@code citations} array of the verdict JSON.
 * Out-of-range references are dropped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CitationExtractor {

    private static final Pattern REFERENCE =
            Pattern.compile("\\[(?:context\\s+)?(\\d{1,3})\\]|\\bcontext\\s+(\\d{1,3})\\b", Pattern.CASE_INSENSITIVE);

    private final VerdictParser verdictParser;
    private final EligibilityProperties properties;

    public List<ExtractedCitation> extractCitations(String responseText, List<ScoredChunk> context) {
        if (responseText == null || responseText.isBlank() || context == null || context.isEmpty()) {
            return List.of();
        }

        Set<Integer> indices = new LinkedHashSet<>();

        verdictParser.findVerdictJson(responseText)
                .map(json -> json.get("citations"))
                .filter(JsonNode::isArray)
                .ifPresent(array -> array.forEach(node -> {
                    if (node.canConvertToInt()) {
                        indices.add(node.asInt());
                    }
                }));

        Matcher matcher = REFERENCE.matcher(responseText);
        while (matcher.find()) {
            String number = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
            indices.add(Integer.parseInt(number));
        }

        List<ExtractedCitation> citations = new ArrayList<>();
        for (Integer index : indices) {
            if (index < 1 || index > context.size()) {
                log.debug("Ignoring reference to context {} (only {} provided)", index, context.size());
                continue;
            }
            ScoredChunk chunk = context.get(index - 1);
            citations.add(ExtractedCitation.builder()
                    .documentVersionId(chunk.getDocumentVersionId())
                    .chunkId(chunk.getChunkId())
                    .excerpt(truncate(chunk.getText(), properties.getExcerptMaxChars()))
                    .relevanceScore(chunk.getSimilarity())
                    .build());
        }

        log.debug("Extracted {} citations from {} references", citations.size(), indices.size());
        return citations;
    }

    static String truncate(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim();
        return trimmed.length() <= maxChars ? trimmed : trimmed.substring(0, maxChars) + "...";
    }
}
