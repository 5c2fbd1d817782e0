package com.csd.pkghealth.service;

import com.csd.pkghealth.model.PopularityAnalysis;
import com.csd.pkghealth.model.PopularityTier;
import com.csd.pkghealth.model.Severity;
import org.springframework.stereotype.Service;

import java.util.OptionalLong;

/**
 * Popularity from weekly npm downloads, on a log scale where one million downloads a week
 * scores 1.0. Packages younger than a year get up to 0.2 extra.
 */
@Service
public class PopularityAnalyzer {

    private static final long VERY_POPULAR = 1_000_000;
    private static final long POPULAR = 100_000;
    private static final long MODERATE = 10_000;
    private static final long NICHE = 1_000;
    private static final long UNPOPULAR = 100;

    private final NpmDownloadsClient downloadsClient;

    public PopularityAnalyzer(NpmDownloadsClient downloadsClient) {
        this.downloadsClient = downloadsClient;
    }

    public PopularityAnalysis analyzePopularity(String packageName, String version, Long ageDays) {
        OptionalLong downloads = downloadsClient.fetchWeeklyDownloads(packageName);
        if (downloads.isEmpty()) {
            // neutral result when stats are unavailable
            return PopularityAnalysis.builder()
                    .packageName(packageName)
                    .version(version)
                    .weeklyDownloads(0)
                    .score(0.5)
                    .tier(PopularityTier.NICHE)
                    .severity(Severity.INFO)
                    .ageAdjusted(false)
                    .build();
        }
        long weekly = downloads.getAsLong();
        return PopularityAnalysis.builder()
                .packageName(packageName)
                .version(version)
                .weeklyDownloads(weekly)
                .score(score(weekly, ageDays))
                .tier(tier(weekly))
                .severity(severity(weekly))
                .ageAdjusted(ageDays != null && ageDays < 365)
                .build();
    }

    public static double score(long weeklyDownloads, Long ageDays) {
        if (weeklyDownloads <= 0) {
            return 0.0;
        }
        double score = Math.log10(weeklyDownloads) / Math.log10(VERY_POPULAR);
        if (ageDays != null && ageDays < 365) {
            double boost = (1.0 - ageDays / 365.0) * 0.2;
            score = Math.min(1.0, score + boost);
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    static PopularityTier tier(long weeklyDownloads) {
        if (weeklyDownloads >= VERY_POPULAR) return PopularityTier.VERY_POPULAR;
        if (weeklyDownloads >= POPULAR) return PopularityTier.POPULAR;
        if (weeklyDownloads >= MODERATE) return PopularityTier.MODERATE;
        if (weeklyDownloads >= NICHE) return PopularityTier.NICHE;
        return PopularityTier.UNPOPULAR;
    }

    static Severity severity(long weeklyDownloads) {
        if (weeklyDownloads < UNPOPULAR) return Severity.WARNING;
        if (weeklyDownloads < NICHE) return Severity.INFO;
        return Severity.OK;
    }
}
