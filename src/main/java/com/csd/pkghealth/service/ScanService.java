package com.csd.pkghealth.service;

import com.csd.pkghealth.config.AnalyzerProperties;
import com.csd.pkghealth.config.ProjectTypePresets;
import com.csd.pkghealth.exception.InvalidManifestException;
import com.csd.pkghealth.exception.PackageCheckException;
import com.csd.pkghealth.model.*;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Runs a full health scan of a project manifest: dependency tree, per-package analysis,
 * summary, recommendations and exit code.
 */
@Slf4j
@Service
public class ScanService {

    private static final int ANALYSIS_THREADS = 10;

    private final AnalyzerProperties properties;
    private final PackageCache cache;
    private final MetadataFetcher fetcher;
    private final AgeAnalyzer ageAnalyzer;
    private final LicenseAnalyzer licenseAnalyzer;
    private final PopularityAnalyzer popularityAnalyzer;
    private final OsvApiClient osvApiClient;
    private final GitHubRepositoryClient gitHubClient;
    private final HealthScorer healthScorer;
    private final IgnoreMatcher ignoreMatcher;
    private final UpgradePathAnalyzer upgradePathAnalyzer;
    private final Clock clock;
    private final ExecutorService analysisPool = Executors.newFixedThreadPool(ANALYSIS_THREADS);
    // every registry request of tree builds and package analysis passes through here
    private final FetchLimiter registryLimiter;

    public ScanService(AnalyzerProperties properties, PackageCache cache, MetadataFetcher fetcher,
                       AgeAnalyzer ageAnalyzer, LicenseAnalyzer licenseAnalyzer, PopularityAnalyzer popularityAnalyzer,
                       OsvApiClient osvApiClient, GitHubRepositoryClient gitHubClient, HealthScorer healthScorer,
                       IgnoreMatcher ignoreMatcher, UpgradePathAnalyzer upgradePathAnalyzer, Clock clock) {
        this.properties = properties;
        this.cache = cache;
        this.fetcher = fetcher;
        this.ageAnalyzer = ageAnalyzer;
        this.licenseAnalyzer = licenseAnalyzer;
        this.popularityAnalyzer = popularityAnalyzer;
        this.osvApiClient = osvApiClient;
        this.gitHubClient = gitHubClient;
        this.healthScorer = healthScorer;
        this.ignoreMatcher = ignoreMatcher;
        this.upgradePathAnalyzer = upgradePathAnalyzer;
        this.clock = clock;
        this.registryLimiter = new FetchLimiter(properties.getDependencyTree().getMaxConcurrentFetches());
    }

    public CompletableFuture<ScanResult> scanAsync(ProjectManifest manifest, ProjectType projectTypeOverride) {
        return CompletableFuture.supplyAsync(() -> scan(manifest, projectTypeOverride));
    }

    /**
     * @param projectTypeOverride project type for this scan, or null for the configured one
     */
    public ScanResult scan(ProjectManifest manifest, ProjectType projectTypeOverride) {
        if (manifest == null || manifest.getName() == null || manifest.getName().isBlank()) {
            throw new InvalidManifestException("Manifest must declare a package name");
        }
        Instant started = clock.instant();
        ProjectType projectType = projectTypeOverride != null ? projectTypeOverride : properties.getProjectType();
        LicensePolicy policy = ProjectTypePresets.resolve(properties.getLicense(), projectType);
        String rootVersion = manifest.getVersion() != null ? manifest.getVersion() : "0.0.0";
        Map<String, String> declared = manifest.getAllDependencies(properties.isIncludeDevDependencies());

        log.info("=== Starting scan for {}@{}: {} declared dependencies, project type {} ===",
                manifest.getName(), rootVersion, declared.size(), projectType.getValue());

        DependencyTreeResult tree = null;
        List<ScanTarget> targets;
        if (properties.getDependencyTree().isEnabled()) {
            tree = buildTree(manifest.getName(), rootVersion, declared);
            targets = targetsFromTree(tree.getRoot());
        } else {
            targets = declared.entrySet().stream()
                    .map(e -> new ScanTarget(e.getKey(), e.getValue(), 1, false, false))
                    .collect(Collectors.toList());
        }

        List<CompletableFuture<Object>> pending = targets.stream()
                .map(target -> CompletableFuture.supplyAsync(() -> analyzeTarget(target, projectType, policy), analysisPool))
                .collect(Collectors.toList());

        List<PackageAnalysis> analyses = new ArrayList<>();
        List<IgnoredPackage> ignored = new ArrayList<>();
        for (CompletableFuture<Object> future : pending) {
            Object outcome = future.join();
            if (outcome instanceof PackageAnalysis) {
                analyses.add((PackageAnalysis) outcome);
            } else if (outcome instanceof IgnoredPackage) {
                ignored.add((IgnoredPackage) outcome);
            }
        }

        ScanSummary summary = summarize(analyses);
        ScanResult result = ScanResult.builder()
                .projectName(manifest.getName())
                .projectVersion(rootVersion)
                .projectType(projectType)
                .timestamp(started)
                .scanDurationMillis(Duration.between(started, clock.instant()).toMillis())
                .summary(summary)
                .packages(analyses)
                .ignored(ignored)
                .recommendations(recommendations(analyses))
                .tree(tree != null ? tree.getRoot() : null)
                .treeSummary(tree != null ? DependencyTreeSummary.of(tree) : null)
                .skippedDependencies(tree != null ? tree.getSkipCounts() : Map.of())
                .exitCode(exitCode(analyses, properties.getFailOn(), properties.getScoring().getMinimumScore()))
                .build();

        log.info("=== Scan for {} completed: {} packages analyzed, {} ignored, average score {}, risk {} ===",
                manifest.getName(), summary.getTotal(), ignored.size(), summary.getAverageScore(),
                summary.getRiskLevel().getValue());
        return result;
    }

    private DependencyTreeResult buildTree(String name, String version, Map<String, String> declared) {
        AnalyzerProperties.DependencyTree treeConfig = properties.getDependencyTree();
        String key = treeKey(name, version, declared, treeConfig);
        if (treeConfig.isCacheTrees()) {
            DependencyTreeResult cached = cache.getTree(key);
            if (cached != null) {
                log.info("Using cached dependency tree for {}@{}", name, version);
                return cached;
            }
        }
        DependencyTreeResult tree = new DependencyTreeBuilder(treeConfig, cache, fetcher, registryLimiter)
                .buildTree(name, version, declared);
        if (treeConfig.isCacheTrees()) {
            cache.setTree(key, tree);
        }
        return tree;
    }

    static String treeKey(String name, String version, Map<String, String> declared,
                          AnalyzerProperties.DependencyTree config) {
        return name + "@" + version + "|" + new TreeMap<>(declared)
                + "|depth=" + config.getMaxDepth()
                + "|transitive=" + config.isAnalyzeTransitive()
                + "|stopOnCircular=" + (config.isDetectCircular() && config.isStopOnCircular());
    }

    /**
     * One target per unique package below the root. The version is the last visited one,
     * the depth the shallowest, and the circular/duplicate flags are set when any occurrence has them.
     */
    static List<ScanTarget> targetsFromTree(DependencyTreeNode root) {
        Map<String, String> versions = DependencyTreeBuilder.collectUniquePackages(root);
        Map<String, ScanTarget> targets = new LinkedHashMap<>();
        root.walk(node -> {
            if (node.getDepth() == 0) {
                return;
            }
            targets.merge(node.getName(),
                    new ScanTarget(node.getName(), versions.get(node.getName()), node.getDepth(),
                            node.isCircular(), node.isDuplicate()),
                    (a, b) -> new ScanTarget(a.name, a.version, Math.min(a.depth, b.depth),
                            a.circular || b.circular, a.duplicate || b.duplicate));
        });
        return new ArrayList<>(targets.values());
    }

    private Object analyzeTarget(ScanTarget target, ProjectType projectType, LicensePolicy policy) {
        AnalyzerProperties.Ignore ignoreRules = properties.getIgnore();
        try {
            Optional<String> ignoredByName = ignoreMatcher.ignoreReason(target.name, null, ignoreRules);
            if (ignoredByName.isPresent()) {
                return new IgnoredPackage(target.name, target.version, ignoredByName.get());
            }

            PackageMetadata metadata = loadMetadata(target.name);
            Optional<String> ignoredByAuthor = ignoreMatcher.ignoreReason(target.name, metadata, ignoreRules);
            if (ignoredByAuthor.isPresent()) {
                return new IgnoredPackage(target.name, target.version, ignoredByAuthor.get());
            }

            return analyzePackage(target, metadata, projectType, policy);
        } catch (Exception e) {
            log.warn("Skipping analysis of {}: {}", target.name, e.getMessage());
            log.debug("Analysis failure for {}", target.name, e);
            return null;
        }
    }

    /**
     * Health check of a single package outside any project, as when evaluating a candidate
     * dependency. Ignore rules do not apply.
     *
     * @param version published version to check, or null for the latest
     * @param projectTypeOverride project type for this check, or null for the configured one
     * @throws PackageCheckException when the registry has no usable record of the package
     */
    public PackageAnalysis check(String packageName, String version, ProjectType projectTypeOverride) {
        if (packageName == null || packageName.isBlank()) {
            throw new IllegalArgumentException("Package name is required");
        }
        ProjectType projectType = projectTypeOverride != null ? projectTypeOverride : properties.getProjectType();
        LicensePolicy policy = ProjectTypePresets.resolve(properties.getLicense(), projectType);
        log.info("Checking {}@{} as {}", packageName, version != null ? version : "latest", projectType.getValue());

        PackageMetadata metadata;
        try {
            metadata = loadMetadata(packageName);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PackageCheckException(packageName, e);
        } catch (Exception e) {
            throw new PackageCheckException(packageName, e);
        }
        if (version != null && !version.isBlank() && !metadata.hasVersion(version)) {
            throw new PackageCheckException(packageName, "version " + version + " is not published");
        }
        String requested = version != null && !version.isBlank() ? version : metadata.getLatestVersion();
        return analyzePackage(new ScanTarget(packageName, requested, 0, false, false), metadata, projectType, policy);
    }

    private PackageAnalysis analyzePackage(ScanTarget target, PackageMetadata metadata, ProjectType projectType,
                                           LicensePolicy policy) {
        String version = metadata.hasVersion(target.version)
                ? target.version
                : DependencyTreeBuilder.resolveVersion(metadata, target.version);
        PackageMetadata focused = version != null ? metadata.forVersion(version) : metadata;

        AgeAnalysis age = ageAnalyzer.analyzeAge(focused, properties.getAge());
        LicenseAnalysis license = licenseAnalyzer.analyzeLicense(focused, projectType, policy);
        PopularityAnalysis popularity = popularityAnalyzer.analyzePopularity(target.name, version, age.getAgeDays());
        VulnerabilityAnalysis vulnerability = osvApiClient.analyze(target.name, version);
        RepositoryAnalysis repository = gitHubClient.analyzeRepository(target.name, age.getRepositoryUrl()).orElse(null);
        UpgradePath upgradePath = upgradePathAnalyzer.analyzeUpgrade(target.name, version, metadata.getLatestVersion(),
                age.getRepositoryUrl(), properties.getUpgradePath());

        HealthScore score = healthScorer.calculateHealthScore(age, license, vulnerability,
                properties.getScoring(), projectType, popularity);

        return PackageAnalysis.builder()
                .packageName(target.name)
                .version(version)
                .depth(target.depth)
                .circular(target.circular)
                .duplicate(target.duplicate)
                .age(age)
                .license(license)
                .popularity(popularity)
                .vulnerability(vulnerability)
                .repository(repository)
                .upgradePath(upgradePath)
                .score(score)
                .overallSeverity(healthScorer.overallSeverity(age, license, vulnerability))
                .build();
    }

    private PackageMetadata loadMetadata(String name) throws Exception {
        PackageMetadata cached = cache.getMetadata(name);
        if (cached != null) {
            return cached;
        }
        Duration timeout = properties.getDependencyTree().getFetchTimeout();
        try {
            PackageMetadata metadata = registryLimiter
                    .submit(() -> DependencyTreeBuilder.timedFetch(fetcher, name, timeout.toMillis()))
                    .get();
            if (metadata == null) {
                throw new IllegalStateException("Registry returned no metadata for " + name);
            }
            cache.setMetadata(name, metadata);
            return metadata;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TimeoutException) {
                throw new TimeoutException("Timed out fetching " + name + " after " + timeout.toMillis() + " ms");
            }
            throw cause instanceof Exception ? (Exception) cause : e;
        }
    }

    FetchLimiter getRegistryLimiter() {
        return registryLimiter;
    }

    static ScanSummary summarize(List<PackageAnalysis> analyses) {
        int excellent = 0, good = 0, fair = 0, poor = 0;
        int critical = 0, warning = 0, info = 0;
        long totalScore = 0;
        for (PackageAnalysis analysis : analyses) {
            switch (analysis.getScore().getRating()) {
                case EXCELLENT: excellent++; break;
                case GOOD: good++; break;
                case FAIR: fair++; break;
                default: poor++; break;
            }
            totalScore += analysis.getScore().getOverall();
            switch (analysis.getOverallSeverity()) {
                case CRITICAL: critical++; break;
                case WARNING: warning++; break;
                case INFO: info++; break;
                default: break;
            }
        }
        double average = analyses.isEmpty() ? 0 : (double) totalScore / analyses.size();

        RiskLevel risk;
        if (critical > 0 || average < 40) {
            risk = RiskLevel.CRITICAL;
        } else if (warning > 5 || average < 60) {
            risk = RiskLevel.HIGH;
        } else if (warning > 0 || average < 80) {
            risk = RiskLevel.MEDIUM;
        } else {
            risk = RiskLevel.LOW;
        }

        return ScanSummary.builder()
                .total(analyses.size())
                .excellent(excellent)
                .good(good)
                .fair(fair)
                .poor(poor)
                .averageScore((int) Math.round(average))
                .riskLevel(risk)
                .criticalIssues(critical)
                .warningIssues(warning)
                .infoIssues(info)
                .build();
    }

    static List<Recommendation> recommendations(List<PackageAnalysis> analyses) {
        List<Recommendation> recommendations = new ArrayList<>();
        for (PackageAnalysis analysis : analyses) {
            if (analysis.getAge().isDeprecated()) {
                String message = analysis.getAge().getDeprecationMessage();
                recommendations.add(Recommendation.builder()
                        .packageName(analysis.getPackageName())
                        .reason("Package is deprecated: " + (message != null ? message : "No longer maintained"))
                        .priority("high")
                        .estimatedEffort("2-4 hours")
                        .build());
            } else if (analysis.getOverallSeverity() == Severity.CRITICAL) {
                recommendations.add(Recommendation.builder()
                        .packageName(analysis.getPackageName())
                        .reason(criticalReason(analysis))
                        .priority("high")
                        .build());
            } else if (analysis.getScore().getOverall() < 40) {
                recommendations.add(Recommendation.builder()
                        .packageName(analysis.getPackageName())
                        .reason(String.format("Low health score (%d/100). Package is %s old.",
                                analysis.getScore().getOverall(), analysis.getAge().getAgeHuman()))
                        .priority("medium")
                        .build());
            }
        }
        return recommendations;
    }

    private static String criticalReason(PackageAnalysis analysis) {
        LicenseAnalysis license = analysis.getLicense();
        if (license.getCategory() == LicenseCategory.COMMERCIAL_INCOMPATIBLE) {
            return "License " + license.getLicense() + " is incompatible with commercial use";
        }
        if (license.getCategory() == LicenseCategory.UNLICENSED) {
            return "Package has no license";
        }
        VulnerabilityAnalysis vulnerability = analysis.getVulnerability();
        if (vulnerability != null && vulnerability.getCriticalCount() > 0) {
            return vulnerability.getCriticalCount() + " critical vulnerabilities reported";
        }
        return "Critical issue detected";
    }

    /**
     * 1 when any package reaches the {@code failOn} severity or scores below {@code minimumScore}.
     */
    static int exitCode(List<PackageAnalysis> analyses, String failOn, int minimumScore) {
        Severity threshold = "none".equalsIgnoreCase(failOn) || failOn == null
                ? null
                : Severity.valueOf(failOn.trim().toUpperCase(Locale.ROOT));
        for (PackageAnalysis analysis : analyses) {
            if (threshold != null && analysis.getOverallSeverity().isAtLeast(threshold)) {
                return 1;
            }
            if (minimumScore > 0 && analysis.getScore().getOverall() < minimumScore) {
                return 1;
            }
        }
        return 0;
    }

    @PreDestroy
    public void shutdown() {
        analysisPool.shutdown();
    }

    static final class ScanTarget {
        final String name;
        final String version;
        final int depth;
        final boolean circular;
        final boolean duplicate;

        ScanTarget(String name, String version, int depth, boolean circular, boolean duplicate) {
            this.name = name;
            this.version = version;
            this.depth = depth;
            this.circular = circular;
            this.duplicate = duplicate;
        }
    }
}
