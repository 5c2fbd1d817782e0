package com.csd.pkghealth.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HealthRating {
    EXCELLENT("excellent"),
    GOOD("good"),
    FAIR("fair"),
    POOR("poor");

    private final String value;

    HealthRating(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static HealthRating fromScore(int overall) {
        if (overall >= 80) return EXCELLENT;
        if (overall >= 60) return GOOD;
        if (overall >= 40) return FAIR;
        return POOR;
    }
}
