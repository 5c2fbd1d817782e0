package com.csd.pkghealth.model;

import lombok.Value;

import java.util.Map;

@Value
public class DependencyTreeResult {
    DependencyTreeNode root;
    int totalNodes;
    Map<SkipReason, Integer> skipCounts;

    public int getSkippedCount() {
        return skipCounts.values().stream().mapToInt(Integer::intValue).sum();
    }
}
