package com.visaeligibility.dto.internal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractedCitation {

    private String documentVersionId;

    private String chunkId;

    private String excerpt;

    private Double relevanceScore;
}
