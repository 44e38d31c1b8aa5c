package com.codeannotation.backend.api.dto;

import java.util.Optional;

/**
 * {@code answer} is written as {@code null} while the pair is unanswered.
 */
public record AssignmentView(
        int id,
        int userId,
        int pairId,
        int experimentId,
        Optional<String> answer,
        int duration
) {}
