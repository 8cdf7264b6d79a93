package com.visaeligibility.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record Chunk(
        String id,
        String documentVersionId,
        Instant documentVersionCreatedAt,
        String text,
        List<Double> embedding,
        Map<String, String> metadata
) {

    public Chunk {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public String visaCode() {
        return metadata.get("visa_code");
    }

    public String jurisdiction() {
        return metadata.get("jurisdiction");
    }
}
