package com.csd.pkghealth.service;

import com.csd.pkghealth.config.AnalyzerProperties;
import com.csd.pkghealth.model.PackageAlternative;
import com.csd.pkghealth.model.RiskLevel;
import com.csd.pkghealth.model.UpdateType;
import com.csd.pkghealth.model.UpgradePath;
import com.csd.pkghealth.model.UpgradeStep;
import lombok.extern.slf4j.Slf4j;
import org.apache.maven.artifact.versioning.ArtifactVersion;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Plans the move from the installed version of a package to its latest release: size of
 * the semver jump, risk, estimated breaking changes and effort, and intermediate steps for
 * multi-major jumps.
 */
@Slf4j
@Service
public class UpgradePathAnalyzer {

    static final int BREAKING_CHANGES_PER_MAJOR = 15;

    private static final Map<String, List<PackageAlternative>> ALTERNATIVES = Map.of(
            "moment", List.of(
                    new PackageAlternative("dayjs", "2KB, Moment.js-like API, tree-shakeable", "MIT"),
                    new PackageAlternative("date-fns", "Modular, functional, immutable", "MIT"),
                    new PackageAlternative("luxon", "Modern successor from a Moment.js author", "MIT")),
            "request", List.of(
                    new PackageAlternative("axios", "Widely used promise-based HTTP client", "MIT"),
                    new PackageAlternative("got", "Lightweight modern HTTP client", "MIT"),
                    new PackageAlternative("node-fetch", "fetch implementation for Node.js", "MIT")),
            "node-sass", List.of(
                    new PackageAlternative("sass", "Pure Dart Sass, no native build step", "MIT")),
            "lodash", List.of(
                    new PackageAlternative("lodash-es", "ES module build of Lodash, tree-shakeable", "MIT"),
                    new PackageAlternative("ramda", "Functional library with immutable data", "MIT")));

    // package -> "<from>-to-<to>" or "update-guide" -> URL
    private static final Map<String, Map<String, String>> MIGRATION_GUIDES = Map.of(
            "webpack", Map.of("4-to-5", "https://webpack.js.org/migrate/5/"),
            "react", Map.of(
                    "16-to-17", "https://react.dev/blog/2020/10/20/react-v17",
                    "17-to-18", "https://react.dev/blog/2022/03/08/react-18-upgrade-guide"),
            "vue", Map.of("2-to-3", "https://v3-migration.vuejs.org/"),
            "angular", Map.of("update-guide", "https://update.angular.io/"));

    private static final Map<String, List<String>> CODEMODS = Map.of(
            "webpack", List.of("webpack-cli migrate"),
            "react", List.of("react-codemod"),
            "vue", List.of("@vue/compat"));

    /**
     * @return the upgrade plan, or null when upgrade analysis is disabled or a version is unknown
     */
    public UpgradePath analyzeUpgrade(String packageName, String currentVersion, String latestVersion,
                                      String repositoryUrl, AnalyzerProperties.UpgradePath config) {
        if (config == null || !config.isEnabled()) {
            return null;
        }
        if (isBlank(currentVersion) || isBlank(latestVersion)) {
            log.debug("No upgrade path for {}: current={}, latest={}", packageName, currentVersion, latestVersion);
            return null;
        }

        UpdateType type = updateType(currentVersion, latestVersion);
        if (type == UpdateType.NONE) {
            return UpgradePath.builder()
                    .packageName(packageName)
                    .currentVersion(currentVersion)
                    .latestVersion(latestVersion)
                    .type(UpdateType.NONE)
                    .risk(RiskLevel.LOW)
                    .estimatedEffort(config.isEstimateEffort() ? "Up to date" : null)
                    .build();
        }

        int breakingChanges = config.isAnalyzeBreakingChanges() ? estimateBreakingChanges(currentVersion, latestVersion) : 0;
        UpgradePath.UpgradePathBuilder path = UpgradePath.builder()
                .packageName(packageName)
                .currentVersion(currentVersion)
                .latestVersion(latestVersion)
                .type(type)
                .risk(risk(type))
                .breakingChanges(breakingChanges)
                .estimatedEffort(config.isEstimateEffort() ? estimateEffort(type, breakingChanges) : null)
                .steps(steps(currentVersion, latestVersion, type));

        if (config.isFetchChangelogs()) {
            path.migrationGuide(migrationGuide(packageName, currentVersion, latestVersion))
                    .changelog(changelog(repositoryUrl))
                    .codemods(CODEMODS.get(packageName));
        }
        if (config.isSuggestAlternatives()) {
            path.alternatives(ALTERNATIVES.get(packageName));
        }
        return path.build();
    }

    static UpdateType updateType(String currentVersion, String latestVersion) {
        if (VersionUtil.compare(currentVersion, latestVersion) >= 0) {
            return UpdateType.NONE;
        }
        ArtifactVersion current = VersionUtil.parse(currentVersion);
        ArtifactVersion latest = VersionUtil.parse(latestVersion);
        if (current.getMajorVersion() != latest.getMajorVersion()) {
            return UpdateType.MAJOR;
        }
        if (current.getMinorVersion() != latest.getMinorVersion()) {
            return UpdateType.MINOR;
        }
        return UpdateType.PATCH;
    }

    static int estimateBreakingChanges(String currentVersion, String latestVersion) {
        if (updateType(currentVersion, latestVersion) != UpdateType.MAJOR) {
            return 0;
        }
        int jump = VersionUtil.parse(latestVersion).getMajorVersion() - VersionUtil.parse(currentVersion).getMajorVersion();
        return Math.max(0, jump) * BREAKING_CHANGES_PER_MAJOR;
    }

    static String estimateEffort(UpdateType type, int breakingChanges) {
        switch (type) {
            case NONE:
                return "Up to date";
            case PATCH:
                return "5-15 minutes";
            case MINOR:
                return "15-30 minutes";
            default:
                break;
        }
        if (breakingChanges == 0) {
            return "30 minutes - 1 hour";
        }
        if (breakingChanges < 10) {
            return "1-4 hours";
        }
        if (breakingChanges < 30) {
            return "4-8 hours";
        }
        return "1-2 days";
    }

    private static RiskLevel risk(UpdateType type) {
        switch (type) {
            case MAJOR:
                return RiskLevel.HIGH;
            case MINOR:
                return RiskLevel.MEDIUM;
            default:
                return RiskLevel.LOW;
        }
    }

    static List<UpgradeStep> steps(String currentVersion, String latestVersion, UpdateType type) {
        if (type == UpdateType.PATCH || type == UpdateType.MINOR) {
            String kind = type == UpdateType.PATCH ? "patch" : "minor";
            return List.of(new UpgradeStep(currentVersion, latestVersion, "Direct " + kind + " update"));
        }
        int currentMajor = VersionUtil.parse(currentVersion).getMajorVersion();
        int latestMajor = VersionUtil.parse(latestVersion).getMajorVersion();
        if (latestMajor - currentMajor <= 1) {
            return List.of(new UpgradeStep(currentVersion, latestVersion,
                    "Major update from v" + currentMajor + " to v" + latestMajor));
        }

        // several majors behind: settle on the current line, then move one major at a time
        String currentLine = currentMajor + ".x.x";
        String nextMajor = (currentMajor + 1) + ".0.0";
        List<UpgradeStep> steps = new ArrayList<>();
        steps.add(new UpgradeStep(currentVersion, currentLine,
                "Update to the latest v" + currentMajor + " release for security fixes"));
        steps.add(new UpgradeStep(currentLine, currentLine,
                "Review the migration guide and replace deprecated APIs"));
        steps.add(new UpgradeStep(currentLine, nextMajor, "Migrate to v" + nextMajor));
        steps.add(new UpgradeStep(nextMajor, latestVersion, latestMajor - currentMajor > 2
                ? "Continue with incremental updates up to the latest version"
                : "Update to v" + latestMajor + " (latest)"));
        return List.copyOf(steps);
    }

    private static String migrationGuide(String packageName, String currentVersion, String latestVersion) {
        Map<String, String> guides = MIGRATION_GUIDES.get(packageName);
        if (guides == null) {
            return null;
        }
        String key = VersionUtil.parse(currentVersion).getMajorVersion() + "-to-"
                + VersionUtil.parse(latestVersion).getMajorVersion();
        return guides.getOrDefault(key, guides.get("update-guide"));
    }

    private static String changelog(String repositoryUrl) {
        if (isBlank(repositoryUrl)) {
            return null;
        }
        return GitHubRepositoryClient.parseOwnerAndRepo(repositoryUrl)
                .map(parts -> "https://github.com/" + parts[0] + "/" + parts[1] + "/releases")
                .orElse(null);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
