package com.csd.pkghealth.service;

import com.csd.pkghealth.model.Severity;
import com.csd.pkghealth.model.VulnerabilityAnalysis;
import com.csd.pkghealth.model.VulnerabilityRecord;
import com.csd.pkghealth.model.VulnerabilitySeverity;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class OsvApiClientTest {

    private static final String LODASH_VULNS = "{\"vulns\":["
            + "{\"id\":\"GHSA-p6mc-m468-83gw\",\"summary\":\"Prototype Pollution in lodash\","
            + " \"aliases\":[\"CVE-2020-8203\"],"
            + " \"database_specific\":{\"severity\":\"HIGH\"},"
            + " \"published\":\"2020-07-15T21:00:00Z\","
            + " \"references\":[{\"type\":\"ADVISORY\",\"url\":\"https://nvd.nist.gov/vuln/detail/CVE-2020-8203\"}],"
            + " \"affected\":[{\"ranges\":[{\"type\":\"SEMVER\",\"events\":[{\"introduced\":\"0\"},{\"fixed\":\"4.17.19\"}]}]}]},"
            + "{\"id\":\"GHSA-35jh-r3h4-6jhm\",\"details\":\"Command Injection in lodash\","
            + " \"severity\":[{\"type\":\"CVSS_V3\",\"score\":\"CVSS:3.1/AV:N/AC:L/PR:H/UI:N/S:U/C:H/I:H/A:H\"}],"
            + " \"affected\":[{\"ecosystem_specific\":{\"severity\":\"CRITICAL\"},"
            + "   \"ranges\":[{\"type\":\"ECOSYSTEM\",\"events\":[{\"introduced\":\"0\"},{\"fixed\":\"4.17.10\"},{\"fixed\":\"4.17.21\"}]}]}]}"
            + "]}";

    private MockWebServer server;
    private OsvApiClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = newClient(true);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private OsvApiClient newClient(boolean enabled) {
        String baseUrl = server.url("/").toString().replaceAll("/$", "");
        return new OsvApiClient(WebClient.builder(), new ObjectMapper(), baseUrl, enabled);
    }

    @Test
    void parsesAdvisoriesForInstalledVersion() throws Exception {
        server.enqueue(new MockResponse().setBody(LODASH_VULNS).addHeader("Content-Type", "application/json"));

        List<VulnerabilityRecord> records = client.queryVulnerabilities("lodash", "^4.17.15");

        RecordedRequest request = server.takeRequest();
        assertEquals("/v1/query", request.getPath());
        String body = request.getBody().readUtf8();
        assertTrue(body.contains("\"ecosystem\":\"npm\""));
        assertTrue(body.contains("\"version\":\"4.17.15\""));

        assertEquals(2, records.size());
        VulnerabilityRecord pollution = records.get(0);
        assertEquals(VulnerabilitySeverity.HIGH, pollution.getSeverity());
        assertEquals("CVE-2020-8203", pollution.getCveId());
        assertEquals("4.17.19", pollution.getFixedVersion());
        assertEquals(7.5, pollution.getCvssScore());
        assertEquals(LocalDateTime.of(2020, 7, 15, 21, 0), pollution.getPublishedDate());
        assertEquals(List.of("https://nvd.nist.gov/vuln/detail/CVE-2020-8203",
                "https://osv.dev/vulnerability/GHSA-p6mc-m468-83gw"), pollution.getReferences());

        VulnerabilityRecord injection = records.get(1);
        assertEquals(VulnerabilitySeverity.CRITICAL, injection.getSeverity());
        assertEquals("Command Injection in lodash", injection.getSummary());
        assertEquals("4.17.21", injection.getFixedVersion());
        assertNull(injection.getCveId());
        assertNull(injection.getPublishedDate());
    }

    @Test
    void analysisCountsBySeverityAndCachesResults() {
        server.enqueue(new MockResponse().setBody(LODASH_VULNS));

        VulnerabilityAnalysis first = client.analyze("lodash", "4.17.15");
        VulnerabilityAnalysis second = client.analyze("lodash", "4.17.15");

        assertEquals(2, first.getTotalCount());
        assertEquals(1, first.getCriticalCount());
        assertEquals(1, first.getHighCount());
        assertEquals(Severity.CRITICAL, first.getSeverity());
        assertEquals(2, second.getTotalCount());
        assertEquals(1, server.getRequestCount());
        assertEquals(1, client.getCacheStats().get("cacheSize"));

        client.clearCache();
        assertEquals(0, client.getCacheStats().get("cacheSize"));
    }

    @Test
    void apiErrorsMeanNoKnownVulnerabilities() {
        server.enqueue(new MockResponse().setResponseCode(500));

        VulnerabilityAnalysis analysis = client.analyze("left-pad", "1.3.0");

        assertEquals(0, analysis.getTotalCount());
        assertEquals(Severity.OK, analysis.getSeverity());
        assertEquals(0, client.getCacheStats().get("cacheSize"));
    }

    @Test
    void failedLookupIsRetriedOnNextCall() {
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setBody("{\"vulns\":[{\"id\":\"GHSA-35jh-r3h4-6jhm\","
                + "\"affected\":[{\"ecosystem_specific\":{\"severity\":\"CRITICAL\"}}]}]}"));

        VulnerabilityAnalysis first = client.analyze("lodash", "4.17.15");
        VulnerabilityAnalysis second = client.analyze("lodash", "4.17.15");

        assertEquals(0, first.getTotalCount());
        assertEquals(1, second.getTotalCount());
        assertEquals(1, second.getCriticalCount());
        assertEquals(2, server.getRequestCount());
    }

    @Test
    void disabledClientMakesNoRequests() {
        OsvApiClient disabled = newClient(false);

        assertNull(disabled.analyze("lodash", "4.17.15"));
        assertNull(client.analyze("lodash", " "));
        assertEquals(0, server.getRequestCount());
    }
}
