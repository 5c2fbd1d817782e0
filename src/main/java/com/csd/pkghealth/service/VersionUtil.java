package com.csd.pkghealth.service;

import org.apache.maven.artifact.versioning.ArtifactVersion;
import org.apache.maven.artifact.versioning.DefaultArtifactVersion;

import java.util.Collection;
import java.util.Optional;

public final class VersionUtil {
    private VersionUtil() {}

    public static int compare(String a, String b) {
        if (a == null && b == null) return 0;
        if (a == null) return -1;
        if (b == null) return 1;
        return parse(a).compareTo(parse(b));
    }

    public static ArtifactVersion parse(String version) {
        return new DefaultArtifactVersion(strip(version));
    }

    public static boolean isBelow(String version, String minVersion) {
        if (minVersion == null || version == null) return false;
        return compare(version, minVersion) < 0;
    }

    /**
     * Highest version of the collection, or empty when it has none.
     */
    public static Optional<String> highest(Collection<String> versions) {
        return versions.stream()
                .filter(v -> v != null && !v.isBlank())
                .max(VersionUtil::compare);
    }

    // npm ranges often carry a leading "v" or "="
    private static String strip(String version) {
        String v = version.trim();
        while (!v.isEmpty() && (v.charAt(0) == 'v' || v.charAt(0) == '=')) {
            v = v.substring(1);
        }
        return v;
    }
}
