package com.codeannotation.backend.api.dto;

public record FilePairEntry(
        int id,
        String leftPath,
        String rightPath
) {}
