package com.codeannotation.backend.api.dto;

public record VersionView(String version) implements Payload {}
