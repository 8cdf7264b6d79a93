package com.visaeligibility.dto.internal;

import com.visaeligibility.model.Outcome;
import com.visaeligibility.model.TokenUsage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Output of the AI reasoning step. {@code outcome} and {@code confidence} are
 * null when the model's answer did not state them in a readable form.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReasoningResult {

    public enum Status {
        COMPLETED,
        UNAVAILABLE
    }

    private Status status;

    private Outcome outcome;

    private Double confidence;

    private String responseText;

    private String prompt;

    private String modelName;

    private TokenUsage tokenUsage;

    @Builder.Default
    private List<ScoredChunk> contextChunks = List.of();

    @Builder.Default
    private List<ExtractedCitation> citations = List.of();

    private String failureReason;

    @Builder.Default
    private List<String> warnings = List.of();

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }

    /**
     * The model ran and both verdict fields were read.
     */
    public boolean hasVerdict() {
        return isCompleted() && outcome != null && confidence != null;
    }

    public static ReasoningResult unavailable(String reason) {
        return ReasoningResult.builder()
                .status(Status.UNAVAILABLE)
                .failureReason(reason)
                .build();
    }
}
