package com.codeannotation.backend.api.dto;

import java.util.List;

public record FeaturePair(
        List<FeatureView> featuresA,
        List<FeatureView> featuresB,
        FeatureView score
) implements Payload {
    public FeaturePair {
        featuresA = List.copyOf(featuresA);
        featuresB = List.copyOf(featuresB);
    }
}
