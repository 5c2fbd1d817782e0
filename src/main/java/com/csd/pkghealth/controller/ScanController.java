package com.csd.pkghealth.controller;

import com.csd.pkghealth.config.AnalyzerProperties;
import com.csd.pkghealth.config.ProjectTypePresets;
import com.csd.pkghealth.model.CacheStats;
import com.csd.pkghealth.model.LicenseAnalysis;
import com.csd.pkghealth.model.PackageAnalysis;
import com.csd.pkghealth.model.PackageMetadata;
import com.csd.pkghealth.model.ProjectManifest;
import com.csd.pkghealth.model.ProjectType;
import com.csd.pkghealth.model.ScanResult;
import com.csd.pkghealth.service.LicenseAnalyzer;
import com.csd.pkghealth.service.OsvApiClient;
import com.csd.pkghealth.service.PackageCache;
import com.csd.pkghealth.service.ScanService;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api")
@Slf4j
public class ScanController {

    private final ScanService scanService;
    private final PackageCache packageCache;
    private final OsvApiClient osvApiClient;
    private final LicenseAnalyzer licenseAnalyzer;
    private final AnalyzerProperties properties;

    public ScanController(ScanService scanService, PackageCache packageCache, OsvApiClient osvApiClient,
                          LicenseAnalyzer licenseAnalyzer, AnalyzerProperties properties) {
        this.scanService = scanService;
        this.packageCache = packageCache;
        this.osvApiClient = osvApiClient;
        this.licenseAnalyzer = licenseAnalyzer;
        this.properties = properties;
    }

    @PostMapping("/scan")
    public ResponseEntity<ScanResult> scan(@RequestBody ScanRequest request) {
        ScanResult result = scanService.scanAsync(request.getManifest(), request.getProjectType()).join();
        return ResponseEntity.ok(result);
    }

    /**
     * Scoped names are addressed as /api/check/@scope/name.
     */
    @GetMapping({"/check/{name}", "/check/{scope}/{name}"})
    public PackageAnalysis check(@PathVariable(required = false) String scope,
                                 @PathVariable String name,
                                 @RequestParam(required = false) String version,
                                 @RequestParam(required = false) String projectType) {
        String packageName = scope != null ? scope + "/" + name : name;
        return scanService.check(packageName, version, ProjectType.fromValue(projectType));
    }

    @GetMapping("/cache/stats")
    public Map<String, Object> cacheStats() {
        CacheStats stats = packageCache.getStats();
        return Map.of(
                "packages", stats,
                "vulnerabilities", osvApiClient.getCacheStats());
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Void> clearCache() {
        packageCache.clear();
        osvApiClient.clearCache();
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/license/analyze")
    public LicenseAnalysis analyzeLicense(@RequestBody LicenseRequest request) {
        ProjectType projectType = request.getProjectType() != null ? request.getProjectType() : properties.getProjectType();
        PackageMetadata metadata = PackageMetadata.builder()
                .name(request.getPackageName() != null ? request.getPackageName() : "unknown")
                .version(request.getVersion())
                .license(request.getLicense())
                .build();
        return licenseAnalyzer.analyzeLicense(metadata, projectType,
                ProjectTypePresets.resolve(properties.getLicense(), projectType));
    }

    @Data
    public static class ScanRequest {
        private ProjectManifest manifest;
        private ProjectType projectType;
    }

    @Data
    public static class LicenseRequest {
        private String license;
        private String packageName;
        private String version;
        private ProjectType projectType;
    }
}
