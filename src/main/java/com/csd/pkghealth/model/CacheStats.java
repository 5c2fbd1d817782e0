package com.csd.pkghealth.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CacheStats {
    long hits;
    long misses;
    double hitRate;
    int metadataSize;
    int treeSize;

    public int getTotalSize() {
        return metadataSize + treeSize;
    }
}
