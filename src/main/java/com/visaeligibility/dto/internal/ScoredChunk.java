package com.visaeligibility.dto.internal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScoredChunk {

    private String chunkId;

    private String documentVersionId;

    private Instant documentVersionCreatedAt;

    private String text;

    private Double similarity;
}
