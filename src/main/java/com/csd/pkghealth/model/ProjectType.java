package com.csd.pkghealth.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ProjectType {
    COMMERCIAL("commercial"),
    SAAS("saas"),
    OPEN_SOURCE("open-source"),
    PERSONAL("personal"),
    INTERNAL("internal"),
    LIBRARY("library"),
    STARTUP("startup"),
    GOVERNMENT("government"),
    EDUCATIONAL("educational"),
    CUSTOM("custom");

    private final String value;

    ProjectType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Project types for which copyleft obligations are acceptable.
     */
    public boolean isCopyleftTolerant() {
        return this == OPEN_SOURCE || this == PERSONAL || this == EDUCATIONAL;
    }

    @JsonCreator
    public static ProjectType fromValue(String value) {
        if (value == null) return null;
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (ProjectType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown project type: " + value);
    }
}
