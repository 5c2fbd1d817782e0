package com.csd.pkghealth.service;

import com.csd.pkghealth.model.PopularityAnalysis;
import com.csd.pkghealth.model.PopularityTier;
import com.csd.pkghealth.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class PopularityAnalyzerTest {

    private final NpmDownloadsClient downloads = mock(NpmDownloadsClient.class);
    private final PopularityAnalyzer analyzer = new PopularityAnalyzer(downloads);

    @Test
    void veryPopularPackage() {
        when(downloads.fetchWeeklyDownloads("react")).thenReturn(OptionalLong.of(20_000_000));

        PopularityAnalysis result = analyzer.analyzePopularity("react", "18.2.0", 700L);

        assertEquals(1.0, result.getScore(), 1e-9);
        assertEquals(PopularityTier.VERY_POPULAR, result.getTier());
        assertEquals(Severity.OK, result.getSeverity());
        assertFalse(result.isAgeAdjusted());
    }

    @Test
    void youngPackagesGetABoost() {
        when(downloads.fetchWeeklyDownloads("fresh")).thenReturn(OptionalLong.of(1_000));

        PopularityAnalysis result = analyzer.analyzePopularity("fresh", "0.1.0", 0L);

        assertEquals(0.7, result.getScore(), 1e-9);
        assertTrue(result.isAgeAdjusted());
        assertEquals(PopularityTier.NICHE, result.getTier());
    }

    @Test
    void neutralWhenStatsAreUnavailable() {
        when(downloads.fetchWeeklyDownloads("private-pkg")).thenReturn(OptionalLong.empty());

        PopularityAnalysis result = analyzer.analyzePopularity("private-pkg", "1.0.0", 10L);

        assertEquals(0.5, result.getScore(), 1e-9);
        assertEquals(Severity.INFO, result.getSeverity());
        assertEquals(0, result.getWeeklyDownloads());
    }

    @Test
    void scoreScale() {
        assertEquals(0.0, PopularityAnalyzer.score(0, null));
        assertEquals(0.5, PopularityAnalyzer.score(1_000, null), 1e-9);
        assertEquals(0.5, PopularityAnalyzer.score(1_000, 365L), 1e-9);
        assertEquals(1.0 / 6, PopularityAnalyzer.score(10, 730L), 1e-9);
        assertEquals(1.0, PopularityAnalyzer.score(900_000, 0L), 1e-9);
    }

    @Test
    void tiersAndSeverities() {
        assertEquals(PopularityTier.UNPOPULAR, PopularityAnalyzer.tier(50));
        assertEquals(Severity.WARNING, PopularityAnalyzer.severity(50));
        assertEquals(PopularityTier.UNPOPULAR, PopularityAnalyzer.tier(500));
        assertEquals(Severity.INFO, PopularityAnalyzer.severity(500));
        assertEquals(PopularityTier.MODERATE, PopularityAnalyzer.tier(10_000));
        assertEquals(PopularityTier.POPULAR, PopularityAnalyzer.tier(250_000));
        assertEquals(Severity.OK, PopularityAnalyzer.severity(1_000));
    }
}
