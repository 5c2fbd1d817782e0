package com.csd.pkghealth.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LicenseCategory {
    COMMERCIAL_FRIENDLY("commercial-friendly"),
    COMMERCIAL_WARNING("commercial-warning"),
    COMMERCIAL_INCOMPATIBLE("commercial-incompatible"),
    UNLICENSED("unlicensed"),
    UNKNOWN("unknown");

    private final String value;

    LicenseCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
