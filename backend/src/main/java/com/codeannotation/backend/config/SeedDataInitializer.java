package com.codeannotation.backend.config;

import com.codeannotation.backend.domain.User;
import com.codeannotation.backend.repo.InMemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Loads {@code annotation.seed.users} so the configured tokens resolve to real users.
 * Users already in the store are left as they are.
 */
@Component
public class SeedDataInitializer implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(SeedDataInitializer.class);

    private final InMemoryStore store;
    private final AnnotationProperties properties;

    public SeedDataInitializer(InMemoryStore store, AnnotationProperties properties) {
        this.store = store;
        this.properties = properties;
    }

    @Override
    public void run(String... args) {
        for (User u : properties.seed().users()) {
            if (store.users.putIfAbsent(u.id(), u) == null) {
                log.info("seeded user {} ({}, {})", u.id(), u.login(), u.role().canonicalName());
            }
        }
    }
}
