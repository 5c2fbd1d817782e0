package com.csd.pkghealth.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PopularityTier {
    UNPOPULAR("unpopular"),
    NICHE("niche"),
    MODERATE("moderate"),
    POPULAR("popular"),
    VERY_POPULAR("very-popular");

    private final String value;

    PopularityTier(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
