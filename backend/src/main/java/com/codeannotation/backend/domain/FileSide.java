package com.codeannotation.backend.domain;

public record FileSide(
        String blobId,
        String path,
        String content
) {}
