package com.visaeligibility.service.retrieval;

import com.visaeligibility.dto.internal.ChunkFilter;
import com.visaeligibility.dto.internal.ScoredChunk;

import java.util.List;

/**
 * Nearest-neighbour search over stored document chunks.
 */
public interface ChunkSearchClient {

    /**
     * @return up to {@code topK} chunks matching the filter, each with its
     *         cosine similarity to {@code vector}
     * @throws com.visaeligibility.exception.RetrievalException on failure
     */
    List<ScoredChunk> search(List<Double> vector, ChunkFilter filter, int topK);
}
