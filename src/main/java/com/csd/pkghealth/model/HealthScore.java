package com.csd.pkghealth.model;

import lombok.Value;

@Value
public class HealthScore {
    int overall;
    HealthRating rating;
    DimensionScores dimensions;
}
