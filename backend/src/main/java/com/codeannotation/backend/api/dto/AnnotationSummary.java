package com.codeannotation.backend.api.dto;

/**
 * Answer tally over every assignment of an experiment.
 */
public record AnnotationSummary(
        int yes,
        int maybe,
        int no,
        int skip,
        int unanswered,
        int total
) implements Payload {}
