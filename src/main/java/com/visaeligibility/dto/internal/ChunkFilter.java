package com.visaeligibility.dto.internal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Metadata restrictions for similarity search. A null field does not filter.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkFilter {

    private String visaCode;

    private String jurisdiction;
}
