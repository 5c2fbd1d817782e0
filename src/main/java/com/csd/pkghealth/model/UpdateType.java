package com.csd.pkghealth.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Largest semver component that differs between the installed and the latest version.
 */
public enum UpdateType {
    NONE,
    PATCH,
    MINOR,
    MAJOR;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
