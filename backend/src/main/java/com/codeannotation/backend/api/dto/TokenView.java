package com.codeannotation.backend.api.dto;

public record TokenView(String token) implements Payload {}
