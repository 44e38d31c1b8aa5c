package com.codeannotation.backend.api.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

public record AssignmentList(List<AssignmentView> assignments) implements Payload {
    public AssignmentList {
        assignments = List.copyOf(assignments);
    }

    @JsonValue
    @Override
    public List<AssignmentView> assignments() {
        return assignments;
    }
}
