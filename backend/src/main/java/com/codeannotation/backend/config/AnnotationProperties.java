package com.codeannotation.backend.config;

import com.codeannotation.backend.domain.User;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Map;

/**
 * {@code annotation.*} settings.
 *
 * @param version reported by {@code GET /api/version}
 * @param auth    static bearer tokens, token to user id
 * @param seed    records loaded into the in-memory store at startup
 */
@Validated
@ConfigurationProperties(prefix = "annotation")
public record AnnotationProperties(
        @NotBlank String version,
        Auth auth,
        Seed seed
) {
    public AnnotationProperties {
        auth = auth == null ? new Auth(Map.of()) : auth;
        seed = seed == null ? new Seed(List.of()) : seed;
    }

    public record Auth(Map<String, Integer> tokens) {
        public Auth {
            tokens = tokens == null ? Map.of() : Map.copyOf(tokens);
        }
    }

    public record Seed(List<User> users) {
        public Seed {
            users = users == null ? List.of() : List.copyOf(users);
        }
    }
}
