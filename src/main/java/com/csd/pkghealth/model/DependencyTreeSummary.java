package com.csd.pkghealth.model;

import lombok.Builder;
import lombok.Value;

import java.util.HashSet;
import java.util.Set;

@Value
@Builder
public class DependencyTreeSummary {
    int totalNodes;
    int uniquePackages;
    int maxDepth;
    int circularDependencies;
    int duplicatePackages;

    public static DependencyTreeSummary of(DependencyTreeResult result) {
        return of(result.getRoot());
    }

    public static DependencyTreeSummary of(DependencyTreeNode root) {
        Set<String> names = new HashSet<>();
        int[] counters = new int[4]; // nodes, maxDepth, circular, duplicate
        root.walk(node -> {
            names.add(node.getName());
            counters[0]++;
            counters[1] = Math.max(counters[1], node.getDepth());
            if (node.isCircular()) counters[2]++;
            if (node.isDuplicate()) counters[3]++;
        });
        return DependencyTreeSummary.builder()
                .totalNodes(counters[0])
                .uniquePackages(names.size())
                .maxDepth(counters[1])
                .circularDependencies(counters[2])
                .duplicatePackages(counters[3])
                .build();
    }
}
