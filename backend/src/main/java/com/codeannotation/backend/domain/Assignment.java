package com.codeannotation.backend.domain;

import java.util.Optional;

/**
 * A file pair handed to a user within an experiment.
 * An empty answer means the pair has not been annotated yet.
 */
public record Assignment(
        int id,
        int userId,
        int pairId,
        int experimentId,
        Optional<String> answer,
        int duration
) {
    public Assignment {
        answer = answer == null ? Optional.empty() : answer;
    }

    public boolean isComplete() {
        return answer.isPresent();
    }
}
