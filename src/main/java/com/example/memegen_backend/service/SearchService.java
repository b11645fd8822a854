package com.example.memegen_backend.service;

import com.example.memegen_backend.config.MemeProperties;
import com.example.memegen_backend.dto.SearchResult;
import com.example.memegen_backend.exception.AttributionAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Client for the remote meme search behaving like the tokenizer: without a configured remote,
 * or when the remote fails, there are simply no results.
 */
@Service
public class SearchService {
    private static final Logger LOGGER = LoggerFactory.getLogger(SearchService.class);
    public static final String MODE_RESULTS = "results";

    private final WebClient webClient;
    private final MemeProperties properties;

    public SearchService(@Qualifier("attributionWebClient") WebClient webClient, MemeProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    /**
     * @param query  words to match, may be empty.
     * @param safe   exclude NSFW hits.
     * @param mode   {@link #MODE_RESULTS} for previously rendered memes, {@code null} for backgrounds.
     * @param apiKey caller credential, may be {@code null}.
     * @return hits ordered by the remote, best first.
     */
    public List<SearchResult> search(String query, boolean safe, String mode, String apiKey) {
        String remote = properties.getRemoteTrackingUrl();
        if (remote == null || remote.isBlank()) {
            LOGGER.debug("Search skipped: no remote configured");
            return List.of();
        }
        try {
            return requestResults(remote, query == null ? "" : query, safe, mode, apiKey);
        } catch (AttributionAccessException ex) {
            LOGGER.warn("Search failed for '{}': {}", query, ex.getMessage());
            return List.of();
        }
    }

    private List<SearchResult> requestResults(String remote, String query, boolean safe, String mode, String apiKey) {
        String endpoint = remote.endsWith("/") ? remote + "images" : remote + "/images";
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("query", query);
        form.add("safe", String.valueOf(safe));
        if (mode != null) {
            form.add("mode", mode);
        }
        try {
            List<SearchResult> results = webClient.post()
                    .uri(endpoint)
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .headers(h -> {
                        if (apiKey != null && !apiKey.isBlank()) {
                            h.set("X-API-KEY", apiKey);
                        }
                    })
                    .body(BodyInserters.fromFormData(form))
                    .retrieve()
                    .bodyToFlux(SearchResult.class)
                    .collectList()
                    .block(Duration.ofSeconds(Math.max(1, properties.getTokenizeTimeoutSeconds())));
            if (results == null) {
                return List.of();
            }
            return results.stream()
                    .filter(Objects::nonNull)
                    .filter(r -> r.imageUrl() != null && !r.imageUrl().isBlank())
                    .toList();
        } catch (WebClientResponseException | WebClientRequestException ex) {
            throw new AttributionAccessException("search request failed", ex);
        } catch (IllegalStateException ex) {
            // block() timed out
            throw new AttributionAccessException("search request timed out", ex);
        }
    }
}
