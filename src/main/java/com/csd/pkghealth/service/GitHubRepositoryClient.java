package com.csd.pkghealth.service;

import com.csd.pkghealth.model.RepositoryAnalysis;
import com.csd.pkghealth.model.Severity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Repository activity from the GitHub REST API. Only consulted when {@code github.enabled}.
 */
@Service
@Slf4j
public class GitHubRepositoryClient {

    // github.com/owner/repo in https, ssh and git+ URL forms
    private static final Pattern GITHUB_URL = Pattern.compile("github\\.com[/:]([^/]+)/([^/#?]+?)(?:\\.git)?(?:[/#?].*)?$");

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final String apiBaseUrl;
    private final String token;
    private final boolean enabled;

    public GitHubRepositoryClient(ObjectMapper mapper,
                                  @Value("${github.api.base-url:https://api.github.com}") String apiBaseUrl,
                                  @Value("${github.token:}") String token,
                                  @Value("${github.enabled:false}") boolean enabled) {
        this.client = new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(15, TimeUnit.SECONDS)
                .build();
        this.mapper = mapper;
        this.apiBaseUrl = apiBaseUrl.endsWith("/") ? apiBaseUrl.substring(0, apiBaseUrl.length() - 1) : apiBaseUrl;
        this.token = token;
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Optional<RepositoryAnalysis> analyzeRepository(String packageName, String repositoryUrl) {
        if (!enabled || repositoryUrl == null) {
            return Optional.empty();
        }
        Optional<String[]> coordinates = parseOwnerAndRepo(repositoryUrl);
        if (coordinates.isEmpty()) {
            log.debug("Repository of {} is not on GitHub: {}", packageName, repositoryUrl);
            return Optional.empty();
        }
        String owner = coordinates.get()[0];
        String repo = coordinates.get()[1];

        Request.Builder request = new Request.Builder()
                .url(String.format("%s/repos/%s/%s", apiBaseUrl, owner, repo))
                .header("Accept", "application/vnd.github+json");
        if (token != null && !token.isBlank()) {
            request.header("Authorization", "token " + token);
        }

        try (Response response = client.newCall(request.build()).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                log.warn("GitHub lookup for {}/{} failed: HTTP {}", owner, repo, response.code());
                return Optional.empty();
            }
            JsonNode root = mapper.readTree(body.string());
            boolean archived = root.path("archived").asBoolean(false);
            return Optional.of(RepositoryAnalysis.builder()
                    .packageName(packageName)
                    .url(root.path("html_url").asText(repositoryUrl))
                    .stars(root.path("stargazers_count").asInt())
                    .forks(root.path("forks_count").asInt())
                    .openIssues(root.path("open_issues_count").asInt())
                    .archived(archived)
                    .lastPush(parseInstant(root.path("pushed_at").asText(null)))
                    .severity(archived ? Severity.WARNING : Severity.OK)
                    .build());
        } catch (IOException e) {
            log.warn("GitHub lookup for {}/{} failed: {}", owner, repo, e.getMessage());
            return Optional.empty();
        }
    }

    static Optional<String[]> parseOwnerAndRepo(String repositoryUrl) {
        Matcher m = GITHUB_URL.matcher(repositoryUrl.trim());
        if (!m.find()) {
            return Optional.empty();
        }
        return Optional.of(new String[]{m.group(1), m.group(2)});
    }

    private static Instant parseInstant(String value) {
        if (value == null) return null;
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
