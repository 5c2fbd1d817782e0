package com.csd.pkghealth.service;

import com.csd.pkghealth.model.VulnerabilityAnalysis;
import com.csd.pkghealth.model.VulnerabilityRecord;
import com.csd.pkghealth.model.VulnerabilitySeverity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Client for the OSV.dev (Open Source Vulnerabilities) API, queried for npm packages.
 */
@Service
@Slf4j
public class OsvApiClient {

    private static final int TIMEOUT_SECONDS = 10;
    private static final String ECOSYSTEM = "npm";
    private static final Pattern NUMERIC = Pattern.compile("\\d+(\\.\\d+)?");

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final boolean enabled;

    // Cache to avoid duplicate API calls for the same package@version
    private final Map<String, List<VulnerabilityRecord>> cache = new ConcurrentHashMap<>();

    public OsvApiClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
                        @Value("${osv.api.base-url:https://api.osv.dev}") String baseUrl,
                        @Value("${osv.enabled:true}") boolean enabled) {
        this.webClient = webClientBuilder
                .baseUrl(baseUrl)
                .build();
        this.objectMapper = objectMapper;
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Known vulnerabilities of an npm package version.
     *
     * @return the analysis, or null when lookups are disabled or the version is unknown
     */
    public VulnerabilityAnalysis analyze(String packageName, String version) {
        if (!enabled || version == null || version.isBlank()) {
            return null;
        }
        return VulnerabilityAnalysis.of(packageName, version, queryVulnerabilities(packageName, version));
    }

    public List<VulnerabilityRecord> queryVulnerabilities(String packageName, String version) {
        // Normalize npm semver prefixes like ^ or ~
        String normalizedVersion = version.trim();
        if (normalizedVersion.startsWith("^") || normalizedVersion.startsWith("~")) {
            normalizedVersion = normalizedVersion.substring(1);
        }

        String cacheKey = packageName + "@" + normalizedVersion;
        List<VulnerabilityRecord> cached = cache.get(cacheKey);
        if (cached != null) {
            log.debug("Cache hit for {}", cacheKey);
            return cached;
        }

        try {
            log.debug("Querying OSV.dev for vulnerabilities: {}@{}", packageName, normalizedVersion);

            Map<String, Object> request = new HashMap<>();
            request.put("version", normalizedVersion);
            request.put("package", Map.of("name", packageName, "ecosystem", ECOSYSTEM));

            final String versionFinal = normalizedVersion;
            String response = webClient.post()
                    .uri("/v1/query")
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(TIMEOUT_SECONDS))
                    .onErrorResume(e -> {
                        log.error("OSV API error for {}@{}: {}", packageName, versionFinal, e.getMessage());
                        return Mono.empty();
                    })
                    .block();
            if (response == null) {
                // failed lookups are retried on the next scan
                return Collections.emptyList();
            }

            List<VulnerabilityRecord> vulnerabilities = parseOsvResponse(response, normalizedVersion);
            cache.put(cacheKey, vulnerabilities);

            if (!vulnerabilities.isEmpty()) {
                log.info("Found {} vulnerabilities for {}@{}", vulnerabilities.size(), packageName, normalizedVersion);
            }
            return vulnerabilities;

        } catch (Exception e) {
            log.error("Failed to query OSV.dev for {}@{}", packageName, normalizedVersion, e);
            return Collections.emptyList();
        }
    }

    private List<VulnerabilityRecord> parseOsvResponse(String jsonResponse, String installedVersion) {
        List<VulnerabilityRecord> records = new ArrayList<>();
        if (jsonResponse == null || jsonResponse.isBlank()) {
            return records;
        }

        try {
            JsonNode vulns = objectMapper.readTree(jsonResponse).get("vulns");
            if (vulns == null || !vulns.isArray() || vulns.isEmpty()) {
                return records;
            }

            for (JsonNode vuln : vulns) {
                try {
                    String id = vuln.get("id").asText();
                    String summary = vuln.has("summary") ? vuln.get("summary").asText() : "";
                    if (summary.isBlank() && vuln.has("details")) {
                        summary = vuln.get("details").asText();
                    }
                    if (summary.length() > 500) {
                        summary = summary.substring(0, 497) + "...";
                    }

                    VulnerabilitySeverity severity = extractSeverity(vuln);
                    records.add(VulnerabilityRecord.builder()
                            .id(id)
                            .cveId(extractCveId(id, vuln))
                            .severity(severity)
                            .cvssScore(extractCvssScore(vuln, severity))
                            .summary(summary)
                            .fixedVersion(extractFixedVersionAtOrAbove(vuln, installedVersion))
                            .publishedDate(extractPublishedDate(vuln))
                            .references(extractReferences(vuln))
                            .build());
                } catch (Exception e) {
                    log.warn("Failed to parse OSV vulnerability entry: {}", e.getMessage());
                }
            }
        } catch (Exception e) {
            log.error("Failed to parse OSV response: {}", e.getMessage());
        }
        return records;
    }

    private VulnerabilitySeverity extractSeverity(JsonNode vuln) {
        VulnerabilitySeverity severity = VulnerabilitySeverity.parse(vuln.path("database_specific").path("severity").asText(null));
        if (severity != null) {
            return severity;
        }
        for (JsonNode affected : vuln.path("affected")) {
            severity = VulnerabilitySeverity.parse(affected.path("ecosystem_specific").path("severity").asText(null));
            if (severity != null) {
                return severity;
            }
        }
        // unrated advisories count as moderate
        return VulnerabilitySeverity.MODERATE;
    }

    private double extractCvssScore(JsonNode vuln, VulnerabilitySeverity severity) {
        for (JsonNode sev : vuln.path("severity")) {
            JsonNode score = sev.get("score");
            // OSV usually carries a CVSS vector here, occasionally a bare number
            if (score != null && score.isNumber()) {
                return score.asDouble();
            }
            if (score != null && score.isTextual() && NUMERIC.matcher(score.asText()).matches()) {
                return Double.parseDouble(score.asText());
            }
        }
        switch (severity) {
            case CRITICAL: return 9.5;
            case HIGH: return 7.5;
            case MODERATE: return 5.0;
            case LOW: return 3.0;
            default: return 0.0;
        }
    }

    private String extractCveId(String id, JsonNode vuln) {
        if (id.startsWith("CVE-")) {
            return id;
        }
        for (JsonNode alias : vuln.path("aliases")) {
            if (alias.asText().startsWith("CVE-")) {
                return alias.asText();
            }
        }
        return null;
    }

    /**
     * Lowest fixed version that is not below the installed one, or null.
     */
    private String extractFixedVersionAtOrAbove(JsonNode vuln, String installedVersion) {
        String bestCandidate = null;
        for (JsonNode affected : vuln.path("affected")) {
            for (JsonNode range : affected.path("ranges")) {
                String type = range.path("type").asText();
                if (!"ECOSYSTEM".equals(type) && !"SEMVER".equals(type)) {
                    continue;
                }
                for (JsonNode event : range.path("events")) {
                    if (!event.has("fixed")) {
                        continue;
                    }
                    String fixed = event.get("fixed").asText();
                    if (installedVersion != null && VersionUtil.isBelow(fixed, installedVersion)) {
                        continue;
                    }
                    if (bestCandidate == null || VersionUtil.isBelow(fixed, bestCandidate)) {
                        bestCandidate = fixed;
                    }
                }
            }
        }
        return bestCandidate;
    }

    private List<String> extractReferences(JsonNode vuln) {
        List<String> refs = new ArrayList<>();
        for (JsonNode ref : vuln.path("references")) {
            if (ref.has("url")) {
                refs.add(ref.get("url").asText());
            }
        }
        if (vuln.has("id")) {
            refs.add("https://osv.dev/vulnerability/" + vuln.get("id").asText());
        }
        return refs;
    }

    private LocalDateTime extractPublishedDate(JsonNode vuln) {
        String published = vuln.path("published").asText(null);
        if (published == null || published.length() < 19) {
            return null;
        }
        try {
            return LocalDateTime.parse(published.substring(0, 19));
        } catch (DateTimeParseException e) {
            log.debug("Unparseable OSV published date: {}", published);
            return null;
        }
    }

    public void clearCache() {
        cache.clear();
        log.info("OSV API cache cleared");
    }

    public Map<String, Object> getCacheStats() {
        Map<String, Object> stats = new HashMap<>();
        stats.put("cacheSize", cache.size());
        stats.put("totalVulnerabilities", cache.values().stream().mapToInt(List::size).sum());
        return stats;
    }
}
