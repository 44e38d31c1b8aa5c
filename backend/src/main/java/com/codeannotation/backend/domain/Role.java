package com.codeannotation.backend.domain;

import java.util.Locale;

public enum Role {
    REQUESTER,
    WORKER;

    // "requester" | "worker"
    public String canonicalName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
