package com.csd.pkghealth.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root manifest of the scanned project (the relevant part of a package.json).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectManifest {
    private String name;
    private String version;
    private Map<String, String> dependencies;
    private Map<String, String> devDependencies;

    /**
     * Declared dependencies in declaration order; dev dependencies follow runtime ones and
     * never override them.
     */
    public Map<String, String> getAllDependencies(boolean includeDev) {
        Map<String, String> all = new LinkedHashMap<>();
        if (dependencies != null) {
            all.putAll(dependencies);
        }
        if (includeDev && devDependencies != null) {
            devDependencies.forEach(all::putIfAbsent);
        }
        return all;
    }
}
