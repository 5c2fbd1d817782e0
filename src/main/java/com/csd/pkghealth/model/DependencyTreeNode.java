package com.csd.pkghealth.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.function.Consumer;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DependencyTreeNode {
    String name;
    String version;
    int depth;
    String parent; // null for the root
    @Builder.Default
    List<DependencyTreeNode> dependencies = List.of();
    boolean circular;
    boolean duplicate;
    List<String> duplicateVersions;
    List<String> circularPath;

    /**
     * Pre-order walk over this node and all descendants.
     */
    public void walk(Consumer<DependencyTreeNode> visitor) {
        visitor.accept(this);
        for (DependencyTreeNode child : dependencies) {
            child.walk(visitor);
        }
    }

    public int countNodes() {
        int count = 1;
        for (DependencyTreeNode child : dependencies) {
            count += child.countNodes();
        }
        return count;
    }
}
