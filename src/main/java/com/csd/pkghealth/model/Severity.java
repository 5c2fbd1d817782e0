package com.csd.pkghealth.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Objects;

public enum Severity {
    OK("ok"),
    INFO("info"),
    WARNING("warning"),
    CRITICAL("critical");

    private final String value;

    Severity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    /**
     * Highest of the given severities, nulls ignored. {@link #OK} when nothing is given.
     */
    public static Severity worst(Severity... severities) {
        return Arrays.stream(severities)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(OK);
    }
}
