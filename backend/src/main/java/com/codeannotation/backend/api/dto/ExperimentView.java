package com.codeannotation.backend.api.dto;

public record ExperimentView(
        int id,
        String name,
        String description,
        float progress
) implements Payload {}
