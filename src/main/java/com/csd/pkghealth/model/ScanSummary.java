package com.csd.pkghealth.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ScanSummary {
    private int total;
    private int excellent;
    private int good;
    private int fair;
    private int poor;
    private int averageScore;
    private RiskLevel riskLevel;
    private int criticalIssues;
    private int warningIssues;
    private int infoIssues;
}
