package com.codeannotation.backend.domain;

public record FilePair(
        int id,
        int experimentId,
        FileSide left,
        FileSide right,
        double score
) {}
