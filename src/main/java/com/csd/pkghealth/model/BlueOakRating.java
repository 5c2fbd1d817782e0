package com.csd.pkghealth.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Blue Oak Council drafting-quality tier of a license.
 */
public enum BlueOakRating {
    GOLD("gold"),
    SILVER("silver"),
    BRONZE("bronze"),
    LEAD("lead"),
    UNRATED("unrated");

    private final String value;

    BlueOakRating(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isLegallySound() {
        return this == GOLD || this == SILVER;
    }
}
