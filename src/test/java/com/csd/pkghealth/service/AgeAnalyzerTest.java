package com.csd.pkghealth.service;

import com.csd.pkghealth.config.AnalyzerProperties;
import com.csd.pkghealth.model.AgeAnalysis;
import com.csd.pkghealth.model.PackageMetadata;
import com.csd.pkghealth.model.Severity;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class AgeAnalyzerTest {

    private final AgeAnalyzer analyzer = new AgeAnalyzer(new MutableClock(RegistryFixtures.NOW));
    private final AnalyzerProperties.Age thresholds = new AnalyzerProperties.Age();

    private static PackageMetadata publishedDaysAgo(long days) {
        return PackageMetadata.builder()
                .name("pkg")
                .version("1.0.0")
                .publishTimes(Map.of("modified", RegistryFixtures.NOW.minus(Duration.ofDays(days))))
                .build();
    }

    @Test
    void recentPackageIsOk() {
        AgeAnalysis result = analyzer.analyzeAge(publishedDaysAgo(30), thresholds);

        assertEquals(30, result.getAgeDays());
        assertEquals("1 month", result.getAgeHuman());
        assertEquals("2024-05-02T00:00:00Z", result.getLastPublish());
        assertEquals(Severity.OK, result.getSeverity());
        assertFalse(result.hasRepository());
    }

    @Test
    void thresholdsAreInclusive() {
        assertEquals(Severity.OK, analyzer.analyzeAge(publishedDaysAgo(729), thresholds).getSeverity());
        assertEquals(Severity.WARNING, analyzer.analyzeAge(publishedDaysAgo(730), thresholds).getSeverity());
        assertEquals(Severity.WARNING, analyzer.analyzeAge(publishedDaysAgo(1824), thresholds).getSeverity());
        assertEquals(Severity.CRITICAL, analyzer.analyzeAge(publishedDaysAgo(1825), thresholds).getSeverity());
    }

    @Test
    void customThresholds() {
        thresholds.setWarn("90d");
        thresholds.setCritical("6m");

        assertEquals(Severity.WARNING, analyzer.analyzeAge(publishedDaysAgo(100), thresholds).getSeverity());
        assertEquals(Severity.CRITICAL, analyzer.analyzeAge(publishedDaysAgo(180), thresholds).getSeverity());
    }

    @Test
    void deprecatedPackageIsCritical() {
        PackageMetadata deprecated = publishedDaysAgo(10).toBuilder()
                .deprecated(true)
                .deprecationMessage("use something else")
                .build();

        AgeAnalysis result = analyzer.analyzeAge(deprecated, thresholds);

        assertEquals(Severity.CRITICAL, result.getSeverity());
        assertTrue(result.isDeprecated());
        assertEquals("use something else", result.getDeprecationMessage());
    }

    @Test
    void missingPublishTimes() {
        PackageMetadata unknown = PackageMetadata.builder().name("pkg").version("1.0.0").build();

        AgeAnalysis result = analyzer.analyzeAge(unknown, thresholds);

        assertEquals("unknown", result.getLastPublish());
        assertEquals(0, result.getAgeDays());
        assertEquals(Severity.WARNING, result.getSeverity());
    }

    @Test
    void fallsBackToVersionPublishTime() {
        Instant published = RegistryFixtures.NOW.minus(Duration.ofDays(400));
        PackageMetadata metadata = PackageMetadata.builder()
                .name("pkg")
                .version("1.0.0")
                .publishTimes(Map.of("1.0.0", published, "created", published.minus(Duration.ofDays(100))))
                .build();

        assertEquals(400, analyzer.analyzeAge(metadata, thresholds).getAgeDays());
    }
}
