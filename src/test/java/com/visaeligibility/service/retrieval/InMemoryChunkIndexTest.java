package com.visaeligibility.service.retrieval;

import com.visaeligibility.dto.internal.ChunkFilter;
import com.visaeligibility.dto.internal.ScoredChunk;
import com.visaeligibility.exception.RetrievalException;
import com.visaeligibility.model.Chunk;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class InMemoryChunkIndexTest {

    private InMemoryChunkIndex index;

    private static Chunk chunk(String id, String visaCode, Instant createdAt, Double... embedding) {
        return new Chunk(id, "doc-" + id, createdAt, "text " + id, List.of(embedding),
                Map.of("visa_code", visaCode, "jurisdiction", "UK"));
    }

    @BeforeEach
    void setUp() {
        index = new InMemoryChunkIndex();
        index.replaceAll(List.of(
                chunk("a", "SKILLED_WORKER", Instant.parse("2024-01-01T00:00:00Z"), 1.0, 0.0),
                chunk("b", "SKILLED_WORKER", Instant.parse("2024-01-01T00:00:00Z"), 0.0, 1.0),
                chunk("c", "STUDENT", Instant.parse("2024-01-01T00:00:00Z"), 1.0, 0.0),
                chunk("d", "SKILLED_WORKER", Instant.parse("2024-01-01T00:00:00Z"), 1.0, 0.0, 0.0)));
    }

    @Test
    @DisplayName("cosine similarity of parallel, orthogonal and zero vectors")
    void cosine() {
        assertThat(InMemoryChunkIndex.cosineSimilarity(List.of(1.0, 1.0), List.of(2.0, 2.0))).isCloseTo(1.0, within(1e-9));
        assertThat(InMemoryChunkIndex.cosineSimilarity(List.of(1.0, 0.0), List.of(0.0, 1.0))).isCloseTo(0.0, within(1e-9));
        assertThat(InMemoryChunkIndex.cosineSimilarity(List.of(0.0, 0.0), List.of(1.0, 1.0))).isZero();
    }

    @Test
    @DisplayName("filters by visa code and skips chunks of another dimension")
    void filtersAndDimensions() {
        List<ScoredChunk> results = index.search(List.of(1.0, 0.0),
                ChunkFilter.builder().visaCode("SKILLED_WORKER").build(), 10);

        assertThat(results).extracting(ScoredChunk::getChunkId).containsExactly("a", "b");
        assertThat(results.get(0).getSimilarity()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    @DisplayName("topK bounds the result")
    void topK() {
        assertThat(index.search(List.of(1.0, 0.0), null, 1)).hasSize(1);
        assertThat(index.search(List.of(1.0, 0.0), null, 0)).isEmpty();
    }

    @Test
    @DisplayName("an empty query vector is rejected")
    void emptyVector() {
        assertThatThrownBy(() -> index.search(List.of(), null, 5))
                .isInstanceOf(RetrievalException.class);
    }
}
