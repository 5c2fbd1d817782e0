package com.csd.pkghealth.service;

import com.csd.pkghealth.model.PackageMetadata;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

public class NpmRegistryClientTest {

    private static final String LEFT_PAD = "{"
            + "\"name\":\"left-pad\","
            + "\"dist-tags\":{\"latest\":\"1.3.0\"},"
            + "\"versions\":{"
            + "  \"1.2.0\":{\"license\":\"WTFPL\"},"
            + "  \"1.3.0\":{\"license\":\"WTFPL\",\"deprecated\":\"use String.prototype.padStart()\","
            + "             \"dependencies\":{\"repeat-string\":\"^1.0.0\"}}"
            + "},"
            + "\"time\":{\"created\":\"2014-03-14T00:00:00.000Z\",\"modified\":\"2018-04-09T00:00:00.000Z\","
            + "         \"1.3.0\":\"2018-04-09T00:00:00.000Z\",\"unpublished\":\"not-a-date\"},"
            + "\"maintainers\":[{\"name\":\"stevemao\"}],"
            + "\"license\":\"WTFPL\","
            + "\"repository\":{\"type\":\"git\",\"url\":\"git+https://github.com/stevemao/left-pad.git\"},"
            + "\"author\":{\"name\":\"azer\"}"
            + "}";

    private MockWebServer server;
    private NpmRegistryClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        String baseUrl = server.url("/").toString().replaceAll("/$", "");
        client = new NpmRegistryClient(WebClient.builder(), new ObjectMapper(), baseUrl);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void fetchesAndParsesRegistryDocument() throws Exception {
        server.enqueue(new MockResponse().setBody(LEFT_PAD).addHeader("Content-Type", "application/json"));

        PackageMetadata metadata = client.fetch("left-pad").join();

        RecordedRequest request = server.takeRequest();
        assertEquals("/left-pad", request.getPath());
        assertEquals("left-pad", metadata.getName());
        assertEquals("1.3.0", metadata.getVersion());
        assertEquals("1.3.0", metadata.getLatestVersion());
        assertEquals("WTFPL", metadata.getLicense());
        assertTrue(metadata.isDeprecated());
        assertEquals("use String.prototype.padStart()", metadata.getDeprecationMessage());
        assertEquals(Map.of("repeat-string", "^1.0.0"), metadata.dependenciesOf("1.3.0"));
        assertEquals(Map.of(), metadata.dependenciesOf("1.2.0"));
        assertEquals("git+https://github.com/stevemao/left-pad.git", metadata.getRepositoryUrl());
        assertEquals("azer", metadata.getAuthor());
        assertEquals(List.of("stevemao"), metadata.getMaintainers());
        assertEquals(Instant.parse("2018-04-09T00:00:00Z"), metadata.lastPublished().orElseThrow());
        assertFalse(metadata.getPublishTimes().containsKey("unpublished"));
    }

    @Test
    void scopedNamesAreEncoded() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"name\":\"@babel/core\",\"dist-tags\":{\"latest\":\"7.24.0\"},"
                + "\"versions\":{\"7.24.0\":{\"license\":\"MIT\"}}}"));

        PackageMetadata metadata = client.fetch("@babel/core").join();

        assertEquals("/%40babel%2Fcore", server.takeRequest().getPath());
        assertEquals("MIT", metadata.getLicense());
    }

    @Test
    void missingPackageFailsTheFuture() {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("{\"error\":\"Not found\"}"));

        assertThrows(CompletionException.class, () -> client.fetch("does-not-exist").join());
    }

    @Test
    void legacyLicenseFormats() {
        PackageMetadata objectForm = client.parseMetadata("a",
                "{\"dist-tags\":{\"latest\":\"1.0.0\"},\"versions\":{\"1.0.0\":{}},\"license\":{\"type\":\"ISC\"}}");
        assertEquals("ISC", objectForm.getLicense());

        PackageMetadata arrayForm = client.parseMetadata("b",
                "{\"licenses\":[{\"type\":\"MIT\"},{\"type\":\"Apache-2.0\"}]}");
        assertEquals("MIT OR Apache-2.0", arrayForm.getLicense());
        assertEquals("b", arrayForm.getName());
        assertNull(arrayForm.getLatestVersion());
    }

    @Test
    void booleanDeprecationAndStringRepository() {
        PackageMetadata metadata = client.parseMetadata("c", "{\"dist-tags\":{\"latest\":\"2.0.0\"},"
                + "\"versions\":{\"2.0.0\":{\"deprecated\":true}},"
                + "\"repository\":\"github:acme/c\",\"author\":\"Jane Doe <jane@example.com>\"}");

        assertTrue(metadata.isDeprecated());
        assertEquals("github:acme/c", metadata.getRepositoryUrl());
        assertEquals("Jane Doe <jane@example.com>", metadata.getAuthor());
    }

    @Test
    void invalidDocumentIsRejected() {
        assertThrows(IllegalStateException.class, () -> client.parseMetadata("x", "{not json"));
    }
}
