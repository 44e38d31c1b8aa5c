package com.codeannotation.backend.domain;

public record Feature(
        String name,
        double weight
) {}
