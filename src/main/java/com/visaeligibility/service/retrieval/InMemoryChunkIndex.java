package com.visaeligibility.service.retrieval;

import com.visaeligibility.dto.internal.ChunkFilter;
import com.visaeligibility.dto.internal.ScoredChunk;
import com.visaeligibility.exception.RetrievalException;
import com.visaeligibility.model.Chunk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Brute-force cosine similarity over the chunks loaded at startup. Chunks whose
 * embedding has a different dimension than the query are skipped.
 */
@Slf4j
@Service
public class InMemoryChunkIndex implements ChunkSearchClient {

    private final List<Chunk> chunks = new CopyOnWriteArrayList<>();

    @Override
    public List<ScoredChunk> search(List<Double> vector, ChunkFilter filter, int topK) {
        if (vector == null || vector.isEmpty()) {
            throw new RetrievalException("Query vector is empty", false);
        }
        if (topK <= 0) {
            return List.of();
        }

        return chunks.stream()
                .filter(chunk -> matches(chunk, filter))
                .filter(chunk -> chunk.embedding() != null && chunk.embedding().size() == vector.size())
                .map(chunk -> toScored(chunk, cosineSimilarity(vector, chunk.embedding())))
                .sorted(ContextRetriever.RANKING)
                .limit(topK)
                .toList();
    }

    public void replaceAll(List<Chunk> loaded) {
        chunks.clear();
        chunks.addAll(loaded);
        log.info("Chunk index holds {} chunks", chunks.size());
    }

    public int size() {
        return chunks.size();
    }

    private static boolean matches(Chunk chunk, ChunkFilter filter) {
        if (filter == null) {
            return true;
        }
        if (filter.getVisaCode() != null && !filter.getVisaCode().equals(chunk.visaCode())) {
            return false;
        }
        return filter.getJurisdiction() == null || filter.getJurisdiction().equals(chunk.jurisdiction());
    }

    private static ScoredChunk toScored(Chunk chunk, double similarity) {
        return ScoredChunk.builder()
                .chunkId(chunk.id())
                .documentVersionId(chunk.documentVersionId())
                .documentVersionCreatedAt(chunk.documentVersionCreatedAt())
                .text(chunk.text())
                .similarity(similarity)
                .build();
    }

    static double cosineSimilarity(List<Double> a, List<Double> b) {
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.size(); i++) {
            double x = a.get(i);
            double y = b.get(i);
            dot += x * y;
            normA += x * x;
            normB += y * y;
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
