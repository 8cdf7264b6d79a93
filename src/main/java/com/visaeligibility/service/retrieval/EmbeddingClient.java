package com.visaeligibility.service.retrieval;

import java.util.List;

public interface EmbeddingClient {

    /**
     * @throws com.visaeligibility.exception.EmbeddingException on failure
     */
    List<Double> embed(String text);
}
