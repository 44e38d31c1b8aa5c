package com.codeannotation.backend.api.dto;

public record CountView(int count) implements Payload {}
