package com.csd.pkghealth.model;

import java.util.Locale;

public enum VulnerabilitySeverity {
    CRITICAL,
    HIGH,
    MODERATE,
    LOW;

    /**
     * Lenient parse of advisory severity labels; MEDIUM is an alias of MODERATE.
     * Returns null for anything unrecognised.
     */
    public static VulnerabilitySeverity parse(String label) {
        if (label == null) return null;
        String upper = label.trim().toUpperCase(Locale.ROOT);
        if ("MEDIUM".equals(upper)) return MODERATE;
        for (VulnerabilitySeverity severity : values()) {
            if (severity.name().equals(upper)) {
                return severity;
            }
        }
        return null;
    }
}
