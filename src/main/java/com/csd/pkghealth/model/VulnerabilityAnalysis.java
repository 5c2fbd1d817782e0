package com.csd.pkghealth.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class VulnerabilityAnalysis {
    @JsonProperty("package")
    String packageName;
    String version;
    @Builder.Default
    List<VulnerabilityRecord> vulnerabilities = List.of();
    int criticalCount;
    int highCount;
    int moderateCount;
    int lowCount;

    public int getTotalCount() {
        return criticalCount + highCount + moderateCount + lowCount;
    }

    public Severity getSeverity() {
        if (criticalCount > 0) return Severity.CRITICAL;
        if (highCount > 0) return Severity.WARNING;
        if (moderateCount > 0 || lowCount > 0) return Severity.INFO;
        return Severity.OK;
    }

    public static VulnerabilityAnalysis of(String packageName, String version, List<VulnerabilityRecord> records) {
        int critical = 0, high = 0, moderate = 0, low = 0;
        for (VulnerabilityRecord record : records) {
            if (record.getSeverity() == null) continue;
            switch (record.getSeverity()) {
                case CRITICAL: critical++; break;
                case HIGH: high++; break;
                case MODERATE: moderate++; break;
                case LOW: low++; break;
                default: break;
            }
        }
        return VulnerabilityAnalysis.builder()
                .packageName(packageName)
                .version(version)
                .vulnerabilities(List.copyOf(records))
                .criticalCount(critical)
                .highCount(high)
                .moderateCount(moderate)
                .lowCount(low)
                .build();
    }
}
