package com.codeannotation.backend.domain;

public record User(
        int id,
        String login,
        String username,
        String avatarUrl,
        Role role
) {}
