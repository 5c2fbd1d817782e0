package com.csd.pkghealth.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PackageAnalysis {
    @JsonProperty("package")
    private String packageName;
    private String version;
    private int depth;          // 1 = direct dependency, 0 for a single-package check
    private boolean circular;
    private boolean duplicate;
    private AgeAnalysis age;
    private LicenseAnalysis license;
    private PopularityAnalysis popularity;       // null when download stats were not fetched
    private VulnerabilityAnalysis vulnerability; // null when no advisory lookup was made
    private RepositoryAnalysis repository;       // null unless GitHub analysis is enabled
    private UpgradePath upgradePath;             // null when upgrade analysis is off
    private HealthScore score;
    private Severity overallSeverity;
}
