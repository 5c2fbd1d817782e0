package com.csd.pkghealth.service;

import com.csd.pkghealth.config.AnalyzerProperties;
import com.csd.pkghealth.model.PackageAlternative;
import com.csd.pkghealth.model.RiskLevel;
import com.csd.pkghealth.model.UpdateType;
import com.csd.pkghealth.model.UpgradePath;
import com.csd.pkghealth.model.UpgradeStep;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class UpgradePathAnalyzerTest {

    private final UpgradePathAnalyzer analyzer = new UpgradePathAnalyzer();
    private AnalyzerProperties.UpgradePath config;

    @BeforeEach
    void setUp() {
        config = new AnalyzerProperties.UpgradePath();
    }

    @Test
    void updateTypes() {
        assertEquals(UpdateType.PATCH, UpgradePathAnalyzer.updateType("1.2.0", "1.2.5"));
        assertEquals(UpdateType.MINOR, UpgradePathAnalyzer.updateType("1.2.0", "1.4.1"));
        assertEquals(UpdateType.MAJOR, UpgradePathAnalyzer.updateType("v1.0.0", "2.0.0"));
        assertEquals(UpdateType.NONE, UpgradePathAnalyzer.updateType("2.0.0", "2.0.0"));
        assertEquals(UpdateType.NONE, UpgradePathAnalyzer.updateType("3.0.0", "2.0.0"));
    }

    @Test
    void minorUpdateIsADirectStep() {
        UpgradePath path = analyzer.analyzeUpgrade("left-pad", "1.2.0", "1.4.1", null, config);

        assertEquals(UpdateType.MINOR, path.getType());
        assertEquals(RiskLevel.MEDIUM, path.getRisk());
        assertEquals(0, path.getBreakingChanges());
        assertEquals("15-30 minutes", path.getEstimatedEffort());
        assertEquals(List.of(new UpgradeStep("1.2.0", "1.4.1", "Direct minor update")), path.getSteps());
        assertNull(path.getAlternatives());
    }

    @Test
    void singleMajorJump() {
        UpgradePath path = analyzer.analyzeUpgrade("express", "4.18.2", "5.0.0", null, config);

        assertEquals(RiskLevel.HIGH, path.getRisk());
        assertEquals(15, path.getBreakingChanges());
        assertEquals("4-8 hours", path.getEstimatedEffort());
        assertEquals(List.of(new UpgradeStep("4.18.2", "5.0.0", "Major update from v4 to v5")), path.getSteps());
    }

    @Test
    void severalMajorsBehindGoesOneMajorAtATime() {
        UpgradePath path = analyzer.analyzeUpgrade("request", "1.2.3", "4.0.0", null, config);

        assertEquals(45, path.getBreakingChanges());
        assertEquals("1-2 days", path.getEstimatedEffort());
        List<UpgradeStep> steps = path.getSteps();
        assertEquals(4, steps.size());
        assertEquals(new UpgradeStep("1.2.3", "1.x.x", "Update to the latest v1 release for security fixes"), steps.get(0));
        assertEquals("1.x.x", steps.get(1).getTo());
        assertEquals(new UpgradeStep("1.x.x", "2.0.0", "Migrate to v2.0.0"), steps.get(2));
        assertEquals(new UpgradeStep("2.0.0", "4.0.0", "Continue with incremental updates up to the latest version"), steps.get(3));
        assertEquals(List.of("axios", "got", "node-fetch"),
                path.getAlternatives().stream().map(PackageAlternative::getName).collect(Collectors.toList()));

        UpgradePath twoMajors = analyzer.analyzeUpgrade("x", "1.0.0", "3.1.0", null, config);
        assertEquals("Update to v3 (latest)", twoMajors.getSteps().get(3).getDescription());
    }

    @Test
    void upToDatePackage() {
        UpgradePath path = analyzer.analyzeUpgrade("lodash", "4.17.21", "4.17.21", null, config);

        assertEquals(UpdateType.NONE, path.getType());
        assertEquals(RiskLevel.LOW, path.getRisk());
        assertEquals("Up to date", path.getEstimatedEffort());
        assertTrue(path.getSteps().isEmpty());
        assertNull(path.getAlternatives());
    }

    @Test
    void optionalParts() {
        config.setAnalyzeBreakingChanges(false);
        config.setEstimateEffort(false);
        config.setSuggestAlternatives(false);

        UpgradePath path = analyzer.analyzeUpgrade("moment", "1.0.0", "2.30.1", null, config);

        assertEquals(0, path.getBreakingChanges());
        assertNull(path.getEstimatedEffort());
        assertNull(path.getAlternatives());
        assertNull(path.getChangelog());

        assertEquals("30 minutes - 1 hour", UpgradePathAnalyzer.estimateEffort(UpdateType.MAJOR, 0));
        assertEquals("1-4 hours", UpgradePathAnalyzer.estimateEffort(UpdateType.MAJOR, 5));
    }

    @Test
    void migrationResources() {
        config.setFetchChangelogs(true);

        UpgradePath react = analyzer.analyzeUpgrade("react", "17.0.2", "18.3.1",
                "git+https://github.com/facebook/react.git", config);
        assertEquals("https://react.dev/blog/2022/03/08/react-18-upgrade-guide", react.getMigrationGuide());
        assertEquals("https://github.com/facebook/react/releases", react.getChangelog());
        assertEquals(List.of("react-codemod"), react.getCodemods());

        UpgradePath angular = analyzer.analyzeUpgrade("angular", "12.0.0", "17.0.0", null, config);
        assertEquals("https://update.angular.io/", angular.getMigrationGuide());
        assertNull(angular.getChangelog());
    }

    @Test
    void disabledOrUnknownVersions() {
        assertNull(analyzer.analyzeUpgrade("lodash", "4.17.21", null, null, config));
        assertNull(analyzer.analyzeUpgrade("lodash", " ", "4.17.21", null, config));

        config.setEnabled(false);
        assertNull(analyzer.analyzeUpgrade("lodash", "4.0.0", "4.17.21", null, config));
    }
}
