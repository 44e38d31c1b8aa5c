package com.codeannotation.backend.api.dto;

public record FeatureView(
        String name,
        double weight
) {}
