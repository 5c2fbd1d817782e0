package com.csd.pkghealth.config;

import com.csd.pkghealth.model.ProjectType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Analyzer settings bound from the {@code health.*} namespace of application.yml.
 * Defaults match an unconfigured commercial project.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "health")
public class AnalyzerProperties {

    @NotNull
    private ProjectType projectType = ProjectType.COMMERCIAL;

    private boolean includeDevDependencies = false;

    /** none, info, warning or critical */
    @Pattern(regexp = "(?i)none|info|warning|critical")
    private String failOn = "critical";

    @Valid
    private License license = new License();
    @Valid
    private Scoring scoring = new Scoring();
    @Valid
    private DependencyTree dependencyTree = new DependencyTree();
    @Valid
    private Cache cache = new Cache();
    @Valid
    private Age age = new Age();
    private Ignore ignore = new Ignore();
    private UpgradePath upgradePath = new UpgradePath();

    @Data
    public static class License {
        private List<String> allow = new ArrayList<>(List.of(
                "MIT", "ISC", "BSD-2-Clause", "BSD-3-Clause", "Apache-2.0",
                "Unlicense", "CC0-1.0", "0BSD", "Zlib", "BSL-1.0"));
        private List<String> deny = new ArrayList<>();
        private List<String> warn = new ArrayList<>(List.of("LGPL-2.1", "LGPL-3.0", "MPL-2.0", "EPL-1.0", "EPL-2.0"));
        private boolean warnOnUnknown = true;
        private boolean checkPatentClauses = true;
        /** Fill empty deny/warn lists from the project type preset. */
        private boolean useProjectPresets = true;
    }

    @Data
    public static class Scoring {
        private boolean enabled = true;
        @Min(0)
        private int minimumScore = 0;
        @Valid
        private Boosters boosters = new Boosters();
    }

    @Data
    public static class Boosters {
        @PositiveOrZero
        private double age = 1.5;
        @PositiveOrZero
        private double deprecation = 4.0;
        @PositiveOrZero
        private double license = 3.0;
        @PositiveOrZero
        private double vulnerability = 2.0;
        @PositiveOrZero
        private double popularity = 1.0;
        @PositiveOrZero
        private double repository = 2.0;
        @PositiveOrZero
        private double updateFrequency = 1.5;
    }

    @Data
    public static class DependencyTree {
        private boolean enabled = true;
        /** 0 means unlimited. */
        @Min(0)
        private int maxDepth = 3;
        private boolean analyzeTransitive = true;
        private boolean detectCircular = true;
        private boolean detectDuplicates = true;
        private boolean stopOnCircular = false;
        private boolean cacheTrees = true;
        @Min(1)
        private int maxConcurrentFetches = 3;
        @NotNull
        private Duration fetchTimeout = Duration.ofSeconds(15);
    }

    @Data
    public static class Cache {
        private boolean enabled = true;
        @NotNull
        private Duration ttl = Duration.ofHours(1);
    }

    @Data
    public static class Age {
        @Pattern(regexp = "^\\d+[ymdYMD]$")
        private String warn = "2y";
        @Pattern(regexp = "^\\d+[ymdYMD]$")
        private String critical = "5y";
    }

    @Data
    public static class Ignore {
        private List<String> packages = new ArrayList<>();
        private List<String> scopes = new ArrayList<>();
        private List<String> prefixes = new ArrayList<>();
        private List<String> authors = new ArrayList<>();
        private Map<String, String> reasons = new HashMap<>();
    }

    @Data
    public static class UpgradePath {
        private boolean enabled = true;
        private boolean analyzeBreakingChanges = true;
        private boolean suggestAlternatives = true;
        /** Attach migration guides, changelog links and codemods. */
        private boolean fetchChangelogs = false;
        private boolean estimateEffort = true;
    }
}
