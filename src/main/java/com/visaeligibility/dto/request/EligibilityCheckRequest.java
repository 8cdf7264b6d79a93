package com.visaeligibility.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.*;

import java.time.LocalDate;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EligibilityCheckRequest {

    @NotEmpty
    private List<@NotBlank String> visaTypeIds;

    // defaults to today
    private LocalDate evaluationDate;

    private Boolean enableAiReasoning;
}
