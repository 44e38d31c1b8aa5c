package com.codeannotation.backend.api.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

public record FilePairList(List<FilePairEntry> pairs) implements Payload {
    public FilePairList {
        pairs = List.copyOf(pairs);
    }

    @JsonValue
    @Override
    public List<FilePairEntry> pairs() {
        return pairs;
    }
}
