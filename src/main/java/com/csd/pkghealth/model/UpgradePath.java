package com.csd.pkghealth.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UpgradePath {
    @JsonProperty("package")
    String packageName;
    String currentVersion;
    String latestVersion;
    UpdateType type;
    RiskLevel risk;
    int breakingChanges;         // estimate, 0 unless a major update is analyzed
    String estimatedEffort;      // null when effort estimation is off
    @Builder.Default
    List<UpgradeStep> steps = List.of();
    String migrationGuide;
    String changelog;
    List<String> codemods;
    List<PackageAlternative> alternatives;
}
