package com.codeannotation.backend.repo;

import com.codeannotation.backend.config.AnnotationProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Bearer token to user id bindings. Seeded from {@code annotation.auth.tokens}.
 */
@Component
public class TokenStore {
    private final ConcurrentHashMap<String, Integer> tokenToUser = new ConcurrentHashMap<>();

    public TokenStore(AnnotationProperties properties) {
        tokenToUser.putAll(properties.auth().tokens());
    }

    public void bind(String token, int userId) {
        tokenToUser.put(token, userId);
    }

    public Integer resolveUserId(String token) {
        return tokenToUser.get(token);
    }
}
