package com.csd.pkghealth.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScanResult {
    private String projectName;
    private String projectVersion;
    private ProjectType projectType;
    private Instant timestamp;
    private long scanDurationMillis;
    private ScanSummary summary;
    private List<PackageAnalysis> packages;
    private List<IgnoredPackage> ignored;
    private List<Recommendation> recommendations;
    private DependencyTreeNode tree;             // null when tree analysis is disabled
    private DependencyTreeSummary treeSummary;
    private Map<SkipReason, Integer> skippedDependencies;
    private int exitCode;
}
