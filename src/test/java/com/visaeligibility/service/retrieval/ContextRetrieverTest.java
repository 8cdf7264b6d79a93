package com.visaeligibility.service.retrieval;

import com.visaeligibility.dto.internal.ChunkFilter;
import com.visaeligibility.dto.internal.ScoredChunk;
import com.visaeligibility.exception.EmbeddingException;
import com.visaeligibility.model.FactValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContextRetrieverTest {

    @Mock private EmbeddingClient embeddingClient;
    @Mock private ChunkSearchClient chunkSearchClient;

    private ContextRetriever retriever;

    @BeforeEach
    void setUp() {
        retriever = new ContextRetriever(embeddingClient, chunkSearchClient);
    }

    private static ScoredChunk scored(String id, double similarity, String createdAt) {
        return ScoredChunk.builder()
                .chunkId(id)
                .documentVersionId("doc-" + id)
                .documentVersionCreatedAt(createdAt == null ? null : Instant.parse(createdAt))
                .text("text " + id)
                .similarity(similarity)
                .build();
    }

    @Nested
    @DisplayName("buildQuery")
    class BuildQuery {

        @Test
        @DisplayName("serializes facts in key order after the visa code")
        void sortedFacts() {
            var facts = Map.of(
                    "sponsor", FactValue.of(true),
                    "salary", FactValue.of(45000),
                    "english_level", FactValue.of("B2"));

            assertThat(retriever.buildQuery(facts, "SKILLED_WORKER"))
                    .isEqualTo("visa type: SKILLED_WORKER; english_level: B2; salary: 45000; sponsor: true");
        }

        @Test
        @DisplayName("falls back to a generic query without facts or visa code")
        void fallback() {
            assertThat(retriever.buildQuery(Map.of(), null)).isEqualTo(ContextRetriever.FALLBACK_QUERY);
        }

        @Test
        @DisplayName("same facts give the same query regardless of map order")
        void deterministic() {
            var first = new java.util.LinkedHashMap<String, FactValue>();
            first.put("b", FactValue.of(2));
            first.put("a", FactValue.of(1));
            var second = new java.util.LinkedHashMap<String, FactValue>();
            second.put("a", FactValue.of(1));
            second.put("b", FactValue.of(2));

            assertThat(retriever.buildQuery(first, "X")).isEqualTo(retriever.buildQuery(second, "X"));
        }
    }

    @Nested
    @DisplayName("search")
    class Search {

        @Test
        @DisplayName("drops chunks below the similarity threshold")
        void threshold() {
            when(chunkSearchClient.search(any(), any(), anyInt()))
                    .thenReturn(List.of(scored("a", 0.9, null), scored("b", 0.6, null)));

            List<ScoredChunk> results = retriever.search(List.of(1.0), new ChunkFilter(), 5, 0.7);

            assertThat(results).extracting(ScoredChunk::getChunkId).containsExactly("a");
        }

        @Test
        @DisplayName("no chunk above the threshold is an empty result, not an error")
        void emptyIsValid() {
            when(chunkSearchClient.search(any(), any(), anyInt()))
                    .thenReturn(List.of(scored("a", 0.2, null)));

            assertThat(retriever.search(List.of(1.0), new ChunkFilter(), 5, 0.7)).isEmpty();
        }

        @Test
        @DisplayName("ties on similarity go to the most recent document version")
        void tieBreak() {
            when(chunkSearchClient.search(any(), any(), anyInt()))
                    .thenReturn(List.of(
                            scored("old", 0.8, "2023-01-01T00:00:00Z"),
                            scored("best", 0.95, "2020-01-01T00:00:00Z"),
                            scored("new", 0.8, "2024-06-01T00:00:00Z")));

            List<ScoredChunk> results = retriever.search(List.of(1.0), new ChunkFilter(), 5, 0.7);

            assertThat(results).extracting(ScoredChunk::getChunkId).containsExactly("best", "new", "old");
        }
    }

    @Test
    @DisplayName("an empty embedding is a non-retryable failure")
    void emptyEmbedding() {
        when(embeddingClient.embed("q")).thenReturn(List.of());

        assertThatThrownBy(() -> retriever.embed("q"))
                .isInstanceOfSatisfying(EmbeddingException.class, e -> assertThat(e.isRetryable()).isFalse());
    }
}
