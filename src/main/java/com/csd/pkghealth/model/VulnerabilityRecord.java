package com.csd.pkghealth.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
public class VulnerabilityRecord {
    private String id;          // GHSA-..., CVE-... or other OSV identifier
    private String cveId;       // may be null
    private VulnerabilitySeverity severity;
    private double cvssScore;
    private String summary;
    private String fixedVersion; // lowest fix at or above the installed version, may be null
    private LocalDateTime publishedDate;
    private List<String> references;
}
