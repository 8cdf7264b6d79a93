package com.visaeligibility.model;

import com.visaeligibility.expression.Expression;

public record Requirement(
        String code,
        String description,
        Expression expression,
        boolean mandatory
) {
}
