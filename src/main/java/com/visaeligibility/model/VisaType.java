package com.visaeligibility.model;

public record VisaType(
        String id,
        String code,
        String jurisdiction,
        String name
) {
}
