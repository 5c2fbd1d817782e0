package com.csd.pkghealth.service;

import com.csd.pkghealth.config.AnalyzerProperties;
import com.csd.pkghealth.model.AgeAnalysis;
import com.csd.pkghealth.model.PackageMetadata;
import com.csd.pkghealth.model.Severity;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Staleness and deprecation of a package version.
 */
@Service
public class AgeAnalyzer {

    private final Clock clock;

    public AgeAnalyzer(Clock clock) {
        this.clock = clock;
    }

    public AgeAnalysis analyzeAge(PackageMetadata metadata, AnalyzerProperties.Age config) {
        Optional<Instant> lastPublished = metadata.lastPublished();
        AgeAnalysis.AgeAnalysisBuilder analysis = AgeAnalysis.builder()
                .packageName(metadata.getName())
                .version(metadata.getVersion())
                .deprecated(metadata.isDeprecated())
                .deprecationMessage(metadata.getDeprecationMessage())
                .repositoryUrl(metadata.getRepositoryUrl());

        if (lastPublished.isEmpty()) {
            return analysis
                    .lastPublish("unknown")
                    .ageDays(0)
                    .ageHuman("unknown")
                    .severity(metadata.isDeprecated() ? Severity.CRITICAL : Severity.WARNING)
                    .build();
        }

        long days = Math.max(0, Duration.between(lastPublished.get(), clock.instant()).toDays());
        return analysis
                .lastPublish(lastPublished.get().toString())
                .ageDays(days)
                .ageHuman(TimeThresholds.daysToHuman(days))
                .severity(severity(days, metadata.isDeprecated(), config))
                .build();
    }

    private static Severity severity(long ageDays, boolean deprecated, AnalyzerProperties.Age config) {
        if (deprecated) {
            return Severity.CRITICAL;
        }
        if (ageDays >= TimeThresholds.toDays(config.getCritical())) {
            return Severity.CRITICAL;
        }
        if (ageDays >= TimeThresholds.toDays(config.getWarn())) {
            return Severity.WARNING;
        }
        return Severity.OK;
    }
}
