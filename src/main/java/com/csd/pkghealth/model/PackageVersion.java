package com.csd.pkghealth.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * One published version of a package as reported by the registry.
 */
@Value
@Builder
public class PackageVersion {
    String version;
    @Builder.Default
    Map<String, String> dependencies = Map.of();
    String license;
    String deprecationMessage; // null when the version is not deprecated
}
