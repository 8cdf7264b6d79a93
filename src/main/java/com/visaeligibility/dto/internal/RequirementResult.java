package com.visaeligibility.dto.internal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RequirementResult {

    private String code;

    private String description;

    private boolean mandatory;

    private RequirementStatus status;

    @Builder.Default
    private List<String> missingVariables = List.of();

    private String errorMessage;
}
