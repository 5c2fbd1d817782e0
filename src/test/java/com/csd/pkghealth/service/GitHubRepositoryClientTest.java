package com.csd.pkghealth.service;

import com.csd.pkghealth.model.RepositoryAnalysis;
import com.csd.pkghealth.model.Severity;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class GitHubRepositoryClientTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private GitHubRepositoryClient client(String token, boolean enabled) {
        return new GitHubRepositoryClient(new ObjectMapper(), server.url("/").toString(), token, enabled);
    }

    @Test
    void readsRepositoryActivity() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"html_url\":\"https://github.com/lodash/lodash\","
                + "\"stargazers_count\":58000,\"forks_count\":7000,\"open_issues_count\":120,"
                + "\"archived\":false,\"pushed_at\":\"2024-01-01T00:00:00Z\"}"));

        Optional<RepositoryAnalysis> result = client("secret", true)
                .analyzeRepository("lodash", "git+https://github.com/lodash/lodash.git");

        RecordedRequest request = server.takeRequest();
        assertEquals("/repos/lodash/lodash", request.getPath());
        assertEquals("token secret", request.getHeader("Authorization"));

        RepositoryAnalysis repo = result.orElseThrow();
        assertEquals(58000, repo.getStars());
        assertEquals(7000, repo.getForks());
        assertEquals(120, repo.getOpenIssues());
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), repo.getLastPush());
        assertEquals(Severity.OK, repo.getSeverity());
    }

    @Test
    void archivedRepositoryIsAWarning() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"archived\":true}"));

        RepositoryAnalysis repo = client("", true).analyzeRepository("old", "https://github.com/acme/old").orElseThrow();

        assertTrue(repo.isArchived());
        assertEquals(Severity.WARNING, repo.getSeverity());
        assertNull(server.takeRequest().getHeader("Authorization"));
    }

    @Test
    void failedLookupIsEmpty() {
        server.enqueue(new MockResponse().setResponseCode(404));

        assertTrue(client("", true).analyzeRepository("gone", "https://github.com/acme/gone").isEmpty());
    }

    @Test
    void skippedWhenDisabledOrNotOnGitHub() {
        assertTrue(client("", false).analyzeRepository("a", "https://github.com/acme/a").isEmpty());
        assertTrue(client("", true).analyzeRepository("b", "https://gitlab.com/acme/b").isEmpty());
        assertTrue(client("", true).analyzeRepository("c", null).isEmpty());
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void parsesRepositoryUrlForms() {
        assertArrayEquals(new String[]{"lodash", "lodash"},
                GitHubRepositoryClient.parseOwnerAndRepo("git+https://github.com/lodash/lodash.git").orElseThrow());
        assertArrayEquals(new String[]{"user", "repo"},
                GitHubRepositoryClient.parseOwnerAndRepo("git@github.com:user/repo.git").orElseThrow());
        assertArrayEquals(new String[]{"owner", "repo"},
                GitHubRepositoryClient.parseOwnerAndRepo("https://github.com/owner/repo/tree/main").orElseThrow());
        assertTrue(GitHubRepositoryClient.parseOwnerAndRepo("https://example.com/owner/repo").isEmpty());
    }
}
