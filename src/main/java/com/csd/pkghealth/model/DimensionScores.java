package com.csd.pkghealth.model;

import lombok.Builder;
import lombok.Value;

/**
 * The seven normalized (0..1) inputs of a health score.
 */
@Value
@Builder
public class DimensionScores {
    double age;
    double deprecation;
    double license;
    double vulnerability;
    double popularity;
    double repository;
    double updateFrequency;

    public static DimensionScores perfect() {
        return new DimensionScores(1, 1, 1, 1, 1, 1, 1);
    }
}
