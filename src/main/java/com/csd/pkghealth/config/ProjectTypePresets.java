package com.csd.pkghealth.config;

import com.csd.pkghealth.model.LicensePolicy;
import com.csd.pkghealth.model.ProjectType;

import java.util.List;

/**
 * Deny/warn license patterns implied by a project type. Explicitly configured lists
 * always win over the preset.
 */
public final class ProjectTypePresets {
    private ProjectTypePresets() {}

    public static List<String> denyPatterns(ProjectType type) {
        switch (type) {
            case COMMERCIAL:
            case GOVERNMENT:
                return List.of("GPL-*", "AGPL-*", "SSPL-*");
            case SAAS:
            case STARTUP:
                return List.of("AGPL-*", "SSPL-*");
            case LIBRARY:
                return List.of("GPL-*", "AGPL-*", "LGPL-*");
            default:
                return List.of();
        }
    }

    public static List<String> warnPatterns(ProjectType type) {
        switch (type) {
            case COMMERCIAL:
                return List.of("LGPL-*", "MPL-*", "EPL-*");
            case SAAS:
                return List.of("GPL-*", "LGPL-*", "MPL-*");
            case LIBRARY:
                return List.of("MPL-*", "EPL-*");
            case STARTUP:
                return List.of("GPL-*", "LGPL-*");
            case GOVERNMENT:
                return List.of("LGPL-*", "MPL-*");
            case INTERNAL:
                return List.of("AGPL-*");
            default:
                return List.of();
        }
    }

    /**
     * Effective policy for a scan: configured lists, with empty deny/warn lists filled from
     * the preset when presets are enabled.
     */
    public static LicensePolicy resolve(AnalyzerProperties.License license, ProjectType type) {
        List<String> deny = license.getDeny();
        List<String> warn = license.getWarn();
        if (license.isUseProjectPresets()) {
            if (deny == null || deny.isEmpty()) deny = denyPatterns(type);
            if (warn == null || warn.isEmpty()) warn = warnPatterns(type);
        }
        return LicensePolicy.builder()
                .allow(license.getAllow() == null ? List.of() : List.copyOf(license.getAllow()))
                .deny(deny == null ? List.of() : List.copyOf(deny))
                .warn(warn == null ? List.of() : List.copyOf(warn))
                .warnOnUnknown(license.isWarnOnUnknown())
                .checkPatentClauses(license.isCheckPatentClauses())
                .build();
    }
}
