package com.codeannotation.backend.api.dto;

/**
 * Body of the create and update experiment requests. Missing fields read as empty strings.
 */
public record ExperimentRequest(String name, String description) {
    public ExperimentRequest {
        name = name == null ? "" : name;
        description = description == null ? "" : description;
    }
}
