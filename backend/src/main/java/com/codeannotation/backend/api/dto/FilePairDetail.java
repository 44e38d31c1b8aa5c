package com.codeannotation.backend.api.dto;

public record FilePairDetail(
        int id,
        String diff,
        double score,
        String leftBlobId,
        String rightBlobId,
        int leftLoc,
        int rightLoc
) implements Payload {}
