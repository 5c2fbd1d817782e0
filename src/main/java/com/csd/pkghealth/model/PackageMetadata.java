package com.csd.pkghealth.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry record for one package. {@code version} is the version under analysis and
 * defaults to the {@code latest} tag.
 */
@Value
@Builder(toBuilder = true)
public class PackageMetadata {
    String name;
    String version;
    String latestVersion;
    @Builder.Default
    Map<String, PackageVersion> versions = Map.of();
    String license;
    boolean deprecated;
    String deprecationMessage;
    String repositoryUrl;
    String homepage;
    String author;
    @Builder.Default
    List<String> maintainers = List.of();
    @Builder.Default
    Map<String, Instant> publishTimes = Map.of();

    public boolean hasVersion(String candidate) {
        return candidate != null && versions.containsKey(candidate);
    }

    public Map<String, String> dependenciesOf(String candidate) {
        PackageVersion record = versions.get(candidate);
        return record != null ? record.getDependencies() : Map.of();
    }

    /**
     * Copy of this record focused on the given version: license and deprecation are taken
     * from the version record when the registry published one.
     */
    public PackageMetadata forVersion(String candidate) {
        PackageVersion record = versions.get(candidate);
        PackageMetadataBuilder builder = toBuilder().version(candidate);
        if (record != null) {
            if (record.getLicense() != null) {
                builder.license(record.getLicense());
            }
            if (record.getDeprecationMessage() != null) {
                builder.deprecated(true).deprecationMessage(record.getDeprecationMessage());
            }
        }
        return builder.build();
    }

    /**
     * Last publish time: registry modification time, then the analyzed version, then creation.
     */
    public Optional<Instant> lastPublished() {
        Instant modified = publishTimes.get("modified");
        if (modified != null) return Optional.of(modified);
        if (version != null && publishTimes.containsKey(version)) return Optional.of(publishTimes.get(version));
        return Optional.ofNullable(publishTimes.get("created"));
    }
}
