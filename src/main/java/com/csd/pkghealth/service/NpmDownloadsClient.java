package com.csd.pkghealth.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.OptionalLong;

/**
 * Weekly download counts from the npm downloads API.
 */
@Service
@Slf4j
public class NpmDownloadsClient {

    private static final int TIMEOUT_SECONDS = 10;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public NpmDownloadsClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
                              @Value("${registry.downloads.base-url:https://api.npmjs.org}") String baseUrl) {
        this.webClient = webClientBuilder.baseUrl(baseUrl).build();
        this.objectMapper = objectMapper;
    }

    /**
     * @return downloads over the last week, or empty when the stats could not be fetched
     */
    public OptionalLong fetchWeeklyDownloads(String packageName) {
        try {
            String response = webClient.get()
                    .uri("/downloads/point/last-week/{name}", packageName)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(TIMEOUT_SECONDS))
                    .onErrorResume(e -> {
                        log.warn("Download stats unavailable for {}: {}", packageName, e.getMessage());
                        return Mono.empty();
                    })
                    .block();
            if (response == null) {
                return OptionalLong.empty();
            }
            JsonNode downloads = objectMapper.readTree(response).get("downloads");
            return downloads != null && downloads.canConvertToLong()
                    ? OptionalLong.of(downloads.asLong())
                    : OptionalLong.empty();
        } catch (Exception e) {
            log.error("Failed to read download stats for {}", packageName, e);
            return OptionalLong.empty();
        }
    }
}
