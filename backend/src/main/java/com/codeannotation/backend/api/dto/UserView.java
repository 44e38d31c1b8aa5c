package com.codeannotation.backend.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UserView(
        int id,
        String login,
        String username,
        @JsonProperty("avatarURL") String avatarUrl,
        String role
) implements Payload {}
