package com.csd.pkghealth.service;

import com.csd.pkghealth.config.AnalyzerProperties;
import com.csd.pkghealth.model.AgeAnalysis;
import com.csd.pkghealth.model.DimensionScores;
import com.csd.pkghealth.model.HealthRating;
import com.csd.pkghealth.model.HealthScore;
import com.csd.pkghealth.model.LicenseAnalysis;
import com.csd.pkghealth.model.PopularityAnalysis;
import com.csd.pkghealth.model.ProjectType;
import com.csd.pkghealth.model.Severity;
import com.csd.pkghealth.model.VulnerabilityAnalysis;
import org.springframework.stereotype.Service;

/**
 * Combines the per-dimension signals of a package into a weighted 0-100 health score.
 */
@Service
public class HealthScorer {

    private static final double DEFAULT_POPULARITY = 0.5;

    /**
     * @param vulnerability may be null when no advisory lookup was made
     * @param popularity    may be null when download stats were not fetched
     */
    public HealthScore calculateHealthScore(AgeAnalysis age, LicenseAnalysis license, VulnerabilityAnalysis vulnerability,
                                            AnalyzerProperties.Scoring scoring, ProjectType projectType,
                                            PopularityAnalysis popularity) {
        if (scoring == null || !scoring.isEnabled()) {
            return new HealthScore(100, HealthRating.EXCELLENT, DimensionScores.perfect());
        }

        double ageScore = ageScore(age.getAgeDays());
        DimensionScores dimensions = DimensionScores.builder()
                .age(ageScore)
                .deprecation(age.isDeprecated() ? 0.0 : 1.0)
                .license(LicenseAnalyzer.licenseScore(license.getCategory(), license.getBlueOakRating(),
                        license.isPatentClause(), projectType))
                .vulnerability(vulnerabilityScore(vulnerability))
                .popularity(popularity != null ? popularity.getScore() : DEFAULT_POPULARITY)
                .repository(age.hasRepository() ? 0.8 : 0.3)
                .updateFrequency(ageScore)
                .build();

        AnalyzerProperties.Boosters b = scoring.getBoosters();
        double weighted = dimensions.getAge() * b.getAge()
                + dimensions.getDeprecation() * b.getDeprecation()
                + dimensions.getLicense() * b.getLicense()
                + dimensions.getVulnerability() * b.getVulnerability()
                + dimensions.getPopularity() * b.getPopularity()
                + dimensions.getRepository() * b.getRepository()
                + dimensions.getUpdateFrequency() * b.getUpdateFrequency();
        double totalWeight = b.getAge() + b.getDeprecation() + b.getLicense() + b.getVulnerability()
                + b.getPopularity() + b.getRepository() + b.getUpdateFrequency();

        int overall = totalWeight > 0 ? (int) Math.round(weighted / totalWeight * 100) : 100;
        overall = Math.max(0, Math.min(100, overall));
        return new HealthScore(overall, HealthRating.fromScore(overall), dimensions);
    }

    public static double ageScore(long ageDays) {
        if (ageDays < 180) return 1.0;
        if (ageDays < 365) return 0.9;
        if (ageDays < 730) return 0.8;
        if (ageDays < 1095) return 0.6;
        if (ageDays < 1825) return 0.4;
        return 0.2;
    }

    public static double vulnerabilityScore(VulnerabilityAnalysis vulnerability) {
        if (vulnerability == null || vulnerability.getTotalCount() == 0) {
            return 1.0;
        }
        double penalty = 0.5 * vulnerability.getCriticalCount()
                + 0.3 * vulnerability.getHighCount()
                + 0.15 * vulnerability.getModerateCount()
                + 0.05 * vulnerability.getLowCount();
        return Math.max(0.0, 1.0 - penalty);
    }

    public Severity overallSeverity(AgeAnalysis age, LicenseAnalysis license, VulnerabilityAnalysis vulnerability) {
        return Severity.worst(
                age != null ? age.getSeverity() : null,
                license != null ? license.getSeverity() : null,
                vulnerability != null ? vulnerability.getSeverity() : null);
    }
}
