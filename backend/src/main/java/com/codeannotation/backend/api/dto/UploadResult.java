package com.codeannotation.backend.api.dto;

public record UploadResult(
        long success,
        long failures
) implements Payload {}
