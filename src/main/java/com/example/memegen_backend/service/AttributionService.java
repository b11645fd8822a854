package com.example.memegen_backend.service;

import com.example.memegen_backend.config.MemeProperties;
import com.example.memegen_backend.dto.RenderRequest;
import com.example.memegen_backend.dto.Rewrite;
import com.example.memegen_backend.exception.AttributionAccessException;
import com.example.memegen_backend.util.UrlUtils;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;

/**
 * Rewrites request URLs to carry attribution tokens and decides which watermark an image gets.
 */
@Service
public class AttributionService {
    private static final Logger LOGGER = LoggerFactory.getLogger(AttributionService.class);
    static final String API_KEY_PARAM = "api_key";

    private final WebClient webClient;
    private final MemeProperties properties;

    public AttributionService(@Qualifier("attributionWebClient") WebClient webClient, MemeProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    /**
     * Removes the caller's API key from the URL and, when a remote tracker is configured,
     * asks it for the tokenized form. Remote failures leave the URL untouched.
     *
     * @param url    full request URL.
     * @param apiKey caller credential, may be {@code null}.
     * @return the canonical URL and whether it differs from {@code url}.
     */
    public Rewrite tokenize(String url, String apiKey) {
        String defaultUrl = UrlUtils.hasParam(url, API_KEY_PARAM) ? UrlUtils.withoutParam(url, API_KEY_PARAM) : url;
        String remote = properties.getRemoteTrackingUrl();
        if (remote == null || remote.isBlank()) {
            return new Rewrite(defaultUrl, !defaultUrl.equals(url));
        }
        try {
            String tokenized = requestToken(remote, defaultUrl, apiKey);
            if (tokenized == null || tokenized.isBlank()) {
                return new Rewrite(defaultUrl, !defaultUrl.equals(url));
            }
            return new Rewrite(tokenized, !tokenized.equals(url));
        } catch (AttributionAccessException ex) {
            LOGGER.warn("Tokenize failed for {}: {}", defaultUrl, ex.getMessage());
            return Rewrite.unchanged(url);
        }
    }

    /**
     * Picks the watermark for a request. {@code changed=true} means the {@code watermark}
     * query parameter is redundant or unknown and should be dropped from the URL.
     */
    public Rewrite resolveWatermark(RenderRequest request) {
        String requested = request.param("watermark");
        String defaultWatermark = properties.getDefaultWatermark();

        String apiKey = request.apiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            LOGGER.info("Authenticated with {}", mask(apiKey));
            if (properties.getApiKeys().contains(apiKey)) {
                return Rewrite.unchanged("");
            }
        }

        if (requested == null || requested.isBlank()) {
            return Rewrite.unchanged(defaultWatermark);
        }
        if (requested.equals(defaultWatermark)) {
            LOGGER.warn("Redundant watermark: {}", requested);
            return new Rewrite(defaultWatermark, true);
        }
        if (!properties.getAllowedWatermarks().contains(requested)) {
            LOGGER.warn("Unknown watermark: {}", requested);
            return new Rewrite(defaultWatermark, true);
        }
        return Rewrite.unchanged(requested);
    }

    private String requestToken(String remote, String url, String apiKey) {
        String endpoint = remote.endsWith("/") ? remote + "tokenize" : remote + "/tokenize";
        try {
            JsonNode body = webClient.post()
                    .uri(endpoint)
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .headers(h -> {
                        if (apiKey != null && !apiKey.isBlank()) {
                            h.set("X-API-KEY", apiKey);
                        }
                    })
                    .body(BodyInserters.fromFormData("url", url))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(Duration.ofSeconds(Math.max(1, properties.getTokenizeTimeoutSeconds())));
            return body == null || !body.hasNonNull("url") ? null : body.get("url").asText();
        } catch (WebClientResponseException | WebClientRequestException ex) {
            throw new AttributionAccessException("tokenize request failed", ex);
        } catch (IllegalStateException ex) {
            // block() timed out
            throw new AttributionAccessException("tokenize request timed out", ex);
        }
    }

    private static String mask(String apiKey) {
        if (apiKey.length() <= 4) {
            return "***";
        }
        return apiKey.substring(0, 2) + "***" + apiKey.substring(apiKey.length() - 2);
    }
}
