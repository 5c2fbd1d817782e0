package com.csd.pkghealth.service;

import com.csd.pkghealth.model.DependencyTreeNode;
import com.csd.pkghealth.model.SkipReason;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of expanding one declared dependency: either a node or the reason it was dropped.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ChildResolution {
    String packageName;
    DependencyTreeNode node;
    SkipReason skipReason;

    public static ChildResolution resolved(DependencyTreeNode node) {
        return new ChildResolution(node.getName(), node, null);
    }

    public static ChildResolution skipped(String packageName, SkipReason reason) {
        return new ChildResolution(packageName, null, reason);
    }

    public boolean isResolved() {
        return node != null;
    }
}
