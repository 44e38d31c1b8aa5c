package com.codeannotation.backend.api.dto;

/**
 * Closed set of shapes a response envelope may carry in its {@code data} field.
 * Each variant is a wire projection, decoupled from the domain records it is built from.
 */
public sealed interface Payload permits
        ExperimentView,
        ExperimentList,
        AssignmentList,
        AnnotationSummary,
        FilePairDetail,
        FilePairList,
        UserView,
        FeaturePair,
        CountView,
        VersionView,
        UploadResult,
        TokenView {
}
