package com.visaeligibility.service.retrieval;

import com.visaeligibility.dto.internal.ChunkFilter;
import com.visaeligibility.dto.internal.ScoredChunk;
import com.visaeligibility.exception.EmbeddingException;
import com.visaeligibility.model.FactValue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Finds the reference material relevant to a case: builds a query from the
 * case facts, embeds it, and ranks stored chunks by cosine similarity.
 * An empty result is a valid answer, not an error.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContextRetriever {

    static final String FALLBACK_QUERY = "immigration eligibility requirements";

    /**
     * Similarity descending, then most recent document version, then chunk id
     * so that equal inputs always rank identically.
     */
    static final Comparator<ScoredChunk> RANKING = Comparator
            .comparing(ScoredChunk::getSimilarity, Comparator.reverseOrder())
            .thenComparing(ScoredChunk::getDocumentVersionCreatedAt,
                    Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(ScoredChunk::getChunkId, Comparator.nullsLast(Comparator.<String>naturalOrder()));

    private final EmbeddingClient embeddingClient;
    private final ChunkSearchClient chunkSearchClient;

    public String buildQuery(Map<String, FactValue> facts, String visaCode) {
        if ((facts == null || facts.isEmpty()) && visaCode == null) {
            return FALLBACK_QUERY;
        }

        StringBuilder query = new StringBuilder();
        if (visaCode != null) {
            query.append("visa type: ").append(visaCode);
        }

        String serializedFacts = new TreeMap<>(facts == null ? Map.<String, FactValue>of() : facts)
                .entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue().asText())
                .collect(Collectors.joining("; "));

        if (!serializedFacts.isEmpty()) {
            if (query.length() > 0) {
                query.append("; ");
            }
            query.append(serializedFacts);
        }
        return query.toString();
    }

    public List<Double> embed(String text) {
        List<Double> vector = embeddingClient.embed(text);
        if (vector == null || vector.isEmpty()) {
            throw new EmbeddingException("Embedding service returned an empty vector", false);
        }
        return vector;
    }

    /**
     * @return chunks with similarity of at least {@code minSimilarity}, best first,
     *         at most {@code topK}; possibly empty
     */
    public List<ScoredChunk> search(List<Double> vector, ChunkFilter filter, int topK, double minSimilarity) {
        List<ScoredChunk> candidates = chunkSearchClient.search(vector, filter, topK);

        List<ScoredChunk> ranked = candidates.stream()
                .filter(Objects::nonNull)
                .filter(c -> c.getSimilarity() != null && c.getSimilarity() >= minSimilarity)
                .sorted(RANKING)
                .limit(topK)
                .toList();

        if (ranked.isEmpty()) {
            log.info("No chunk reached similarity {} (filter {}, {} candidates)",
                    minSimilarity, filter, candidates.size());
        } else {
            log.debug("Retrieved {} chunks, top similarity {}",
                    ranked.size(), String.format("%.4f", ranked.get(0).getSimilarity()));
        }
        return ranked;
    }
}
