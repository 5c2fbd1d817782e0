package com.csd.pkghealth.service;

import com.csd.pkghealth.model.PackageMetadata;
import com.csd.pkghealth.model.PackageVersion;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Client for the npm registry document API ({@code GET /<package>}).
 * Registry JSON is turned into a typed {@link PackageMetadata} here and nowhere else.
 */
@Service
@Slf4j
public class NpmRegistryClient implements MetadataFetcher {

    private static final int TIMEOUT_SECONDS = 30;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public NpmRegistryClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
                             @Value("${registry.npm.base-url:https://registry.npmjs.org}") String baseUrl) {
        this.webClient = webClientBuilder
                .baseUrl(baseUrl)
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(32 * 1024 * 1024))
                .build();
        this.objectMapper = objectMapper;
    }

    @Override
    public CompletableFuture<PackageMetadata> fetch(String packageName) {
        log.debug("Fetching registry metadata for {}", packageName);
        return webClient.get()
                .uri("/{name}", packageName)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofSeconds(TIMEOUT_SECONDS))
                .map(body -> parseMetadata(packageName, body))
                .doOnError(e -> log.debug("Registry fetch failed for {}: {}", packageName, e.getMessage()))
                .toFuture();
    }

    PackageMetadata parseMetadata(String packageName, String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Invalid registry document for " + packageName, e);
        }

        String latest = text(root.path("dist-tags"), "latest");
        Map<String, PackageVersion> versions = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = root.path("versions").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            JsonNode v = entry.getValue();
            versions.put(entry.getKey(), PackageVersion.builder()
                    .version(entry.getKey())
                    .dependencies(stringMap(v.path("dependencies")))
                    .license(license(v))
                    .deprecationMessage(deprecation(v.get("deprecated")))
                    .build());
        }

        Map<String, Instant> times = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> timeFields = root.path("time").fields();
        while (timeFields.hasNext()) {
            Map.Entry<String, JsonNode> entry = timeFields.next();
            try {
                times.put(entry.getKey(), Instant.parse(entry.getValue().asText()));
            } catch (DateTimeParseException e) {
                log.debug("Ignoring unparseable time '{}' for {}", entry.getValue().asText(), packageName);
            }
        }

        List<String> maintainers = new ArrayList<>();
        for (JsonNode m : root.path("maintainers")) {
            String name = m.isTextual() ? m.asText() : text(m, "name");
            if (name != null) maintainers.add(name);
        }

        String rootDeprecation = deprecation(root.get("deprecated"));
        PackageMetadata metadata = PackageMetadata.builder()
                .name(root.hasNonNull("name") ? root.get("name").asText() : packageName)
                .version(latest)
                .latestVersion(latest)
                .versions(versions)
                .license(license(root))
                .deprecated(rootDeprecation != null)
                .deprecationMessage(rootDeprecation)
                .repositoryUrl(repository(root.get("repository")))
                .homepage(text(root, "homepage"))
                .author(person(root.get("author")))
                .maintainers(maintainers)
                .publishTimes(times)
                .build();
        return latest != null ? metadata.forVersion(latest) : metadata;
    }

    private static String license(JsonNode node) {
        JsonNode license = node.get("license");
        if (license != null && !license.isNull()) {
            return license.isTextual() ? license.asText() : text(license, "type");
        }
        // legacy "licenses": [{type}, ...] reads as a dual license
        JsonNode licenses = node.get("licenses");
        if (licenses != null && licenses.isArray() && !licenses.isEmpty()) {
            List<String> types = new ArrayList<>();
            for (JsonNode l : licenses) {
                String type = l.isTextual() ? l.asText() : text(l, "type");
                if (type != null) types.add(type);
            }
            return types.isEmpty() ? null : String.join(" OR ", types);
        }
        return null;
    }

    private static String deprecation(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.isBoolean()) return node.asBoolean() ? "deprecated" : null;
        String message = node.asText();
        return message.isBlank() ? null : message;
    }

    private static String repository(JsonNode node) {
        if (node == null || node.isNull()) return null;
        return node.isTextual() ? node.asText() : text(node, "url");
    }

    private static String person(JsonNode node) {
        if (node == null || node.isNull()) return null;
        return node.isTextual() ? node.asText() : text(node, "name");
    }

    private static Map<String, String> stringMap(JsonNode node) {
        if (!node.isObject()) return Map.of();
        Map<String, String> map = new LinkedHashMap<>();
        node.fields().forEachRemaining(e -> map.put(e.getKey(), e.getValue().asText()));
        return map;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }
}
