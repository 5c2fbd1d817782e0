package com.csd.pkghealth.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Legal family of a license. Declaration order runs from most to least permissive.
 */
public enum LicenseFamily {
    PERMISSIVE("permissive", LicenseCategory.COMMERCIAL_FRIENDLY),
    WEAK_COPYLEFT("weak-copyleft", LicenseCategory.COMMERCIAL_WARNING),
    STRONG_COPYLEFT("strong-copyleft", LicenseCategory.COMMERCIAL_INCOMPATIBLE),
    NETWORK_COPYLEFT("network-copyleft", LicenseCategory.COMMERCIAL_INCOMPATIBLE);

    private final String value;
    private final LicenseCategory category;

    LicenseFamily(String value, LicenseCategory category) {
        this.value = value;
        this.category = category;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public LicenseCategory getCategory() {
        return category;
    }

    public boolean isCopyleft() {
        return this != PERMISSIVE;
    }
}
