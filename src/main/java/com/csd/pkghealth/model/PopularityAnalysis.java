package com.csd.pkghealth.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PopularityAnalysis {
    @JsonProperty("package")
    String packageName;
    String version;
    long weeklyDownloads;
    double score;
    PopularityTier tier;
    Severity severity;
    boolean ageAdjusted;
}
