package com.codeannotation.backend.api.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

public record ExperimentList(List<ExperimentView> experiments) implements Payload {
    public ExperimentList {
        experiments = List.copyOf(experiments);
    }

    // serialized as a bare JSON array
    @JsonValue
    @Override
    public List<ExperimentView> experiments() {
        return experiments;
    }
}
