package com.example.memegen_backend.service;

import com.example.memegen_backend.config.MemeProperties;
import com.example.memegen_backend.dto.SearchResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class SearchServiceTest {

    private MemeProperties properties;

    @BeforeEach
    void setUp() {
        properties = new MemeProperties();
    }

    @Test
    void noRemoteMeansNoResults() {
        AtomicInteger calls = new AtomicInteger();
        WebClient client = WebClient.builder()
                .exchangeFunction(req -> {
                    calls.incrementAndGet();
                    return Mono.just(ClientResponse.create(HttpStatus.OK).build());
                })
                .build();
        SearchService service = new SearchService(client, properties);

        assertThat(service.search("cats", true, null, "k")).isEmpty();
        assertThat(calls.get()).isZero();
    }

    @Test
    void remoteHitsAreParsedInOrder() {
        properties.setRemoteTrackingUrl("http://tracker.test/");
        AtomicReference<ClientRequest> seen = new AtomicReference<>();
        WebClient client = WebClient.builder()
                .exchangeFunction(req -> {
                    seen.set(req);
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body("[{\"image_url\":\"http://localhost/images/fry/a.png\",\"confidence\":0.75,\"extra\":1},"
                                    + "{\"image_url\":\"\",\"confidence\":0.5},"
                                    + "{\"image_url\":\"http://localhost/images/ds/b.png\",\"confidence\":0.25}]")
                            .build());
                })
                .build();
        SearchService service = new SearchService(client, properties);

        List<SearchResult> results = service.search("cats", false, SearchService.MODE_RESULTS, "k");

        assertThat(results).containsExactly(
                new SearchResult("http://localhost/images/fry/a.png", 0.75),
                new SearchResult("http://localhost/images/ds/b.png", 0.25));
        assertThat(seen.get().url().toString()).isEqualTo("http://tracker.test/images");
        assertThat(seen.get().headers().getFirst("X-API-KEY")).isEqualTo("k");
    }

    @Test
    void remoteFailureMeansNoResults() {
        properties.setRemoteTrackingUrl("http://tracker.test");
        WebClient client = WebClient.builder()
                .exchangeFunction(req -> Mono.just(ClientResponse.create(HttpStatus.BAD_GATEWAY).build()))
                .build();
        SearchService service = new SearchService(client, properties);

        assertThat(service.search("cats", true, null, null)).isEmpty();
    }
}
