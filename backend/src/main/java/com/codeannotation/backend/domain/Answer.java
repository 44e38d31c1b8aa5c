package com.codeannotation.backend.domain;

import java.util.Optional;

public enum Answer {
    YES("yes"),
    MAYBE("maybe"),
    NO("no"),
    SKIP("skip");

    private final String value;

    Answer(String value) {
        this.value = value;
    }

    public static Optional<Answer> fromValue(String value) {
        for (Answer a : values()) {
            if (a.value.equals(value)) return Optional.of(a);
        }
        return Optional.empty();
    }
}
