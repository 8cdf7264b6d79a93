package com.visaeligibility.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class Citation {

    String id;

    String reasoningLogId;

    String documentVersionId;

    String chunkId;

    String excerpt;

    Double relevanceScore;
}
