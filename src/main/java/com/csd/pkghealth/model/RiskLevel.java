package com.csd.pkghealth.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
