package com.example.memegen_backend.controller;

import com.example.memegen_backend.dto.AutomaticMemeRequest;
import com.example.memegen_backend.dto.AutomaticMemeResponse;
import com.example.memegen_backend.dto.CustomMemeRequest;
import com.example.memegen_backend.dto.ExampleResponse;
import com.example.memegen_backend.dto.MemeCreateRequest;
import com.example.memegen_backend.dto.MemeUrlResponse;
import com.example.memegen_backend.dto.RenderRequest;
import com.example.memegen_backend.service.MemeImageService;
import com.example.memegen_backend.service.MemeUrlService;
import com.example.memegen_backend.util.UrlUtils;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/images")
public class MemeController {
    static final String API_KEY_HEADER = "X-API-KEY";

    private final MemeImageService images;
    private final MemeUrlService urls;

    public MemeController(MemeImageService images, MemeUrlService urls) {
        this.images = images;
        this.urls = urls;
    }

    @GetMapping({"", "/"})
    public ResponseEntity<List<ExampleResponse>> index(@RequestParam(value = "filter", required = false) String filter) {
        return ResponseEntity.ok(urls.examples(baseUrl(), filter));
    }

    @PostMapping({"", "/"})
    public ResponseEntity<MemeUrlResponse> create(@RequestBody(required = false) MemeCreateRequest body) {
        String url = urls.create(baseUrl(), body);
        return created(url, body != null && Boolean.TRUE.equals(body.redirect()));
    }

    @PostMapping("/custom")
    public ResponseEntity<MemeUrlResponse> custom(@Valid @RequestBody(required = false) CustomMemeRequest body) {
        String url = urls.createCustom(baseUrl(), body);
        return created(url, body != null && Boolean.TRUE.equals(body.redirect()));
    }

    @PostMapping("/automatic")
    public ResponseEntity<AutomaticMemeResponse> automatic(
            @RequestBody(required = false) AutomaticMemeRequest body,
            @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey) {
        AutomaticMemeResponse meme = urls.automatic(body, apiKey);
        if (body != null && Boolean.TRUE.equals(body.redirect())) {
            return ResponseEntity.status(HttpStatus.FOUND)
                    .location(URI.create(UrlUtils.withParam(meme.url(), "status", "201")))
                    .build();
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(meme);
    }

    @GetMapping("/custom")
    public ResponseEntity<List<MemeUrlResponse>> popularCustom(
            @RequestParam(value = "filter", required = false) String filter,
            @RequestParam(value = "safe", defaultValue = "true") boolean safe,
            @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey) {
        return ResponseEntity.ok(urls.popularCustom(filter, safe, apiKey));
    }

    @GetMapping("/{fileName:.+\\.\\w+}")
    public CompletableFuture<ResponseEntity<Resource>> blank(
            @PathVariable String fileName,
            @RequestParam Map<String, String> params,
            @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey,
            HttpServletRequest req) {
        int dot = fileName.lastIndexOf('.');
        RenderRequest request = toRequest(fileName.substring(0, dot), "", fileName.substring(dot + 1), params, apiKey, req);
        return images.templateBackground(request);
    }

    @GetMapping("/{templateId}/{*textPaths}")
    public CompletableFuture<ResponseEntity<Resource>> text(
            @PathVariable String templateId,
            @PathVariable String textPaths,
            @RequestParam Map<String, String> params,
            @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey,
            HttpServletRequest req) {
        String path = textPaths.startsWith("/") ? textPaths.substring(1) : textPaths;
        int dot = path.lastIndexOf('.');
        if (path.isEmpty() || path.startsWith("/") || dot <= 0 || dot < path.lastIndexOf('/')
                || dot == path.length() - 1) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "IMAGE_PATH_INVALID");
        }
        RenderRequest request = toRequest(templateId, path.substring(0, dot), path.substring(dot + 1), params, apiKey, req);
        return images.textImage(request);
    }

    private RenderRequest toRequest(String templateId, String slug, String extension, Map<String, String> params,
                                    String apiKeyHeader, HttpServletRequest req) {
        String apiKey = apiKeyHeader != null && !apiKeyHeader.isBlank()
                ? apiKeyHeader
                : UrlUtils.arg(params, null, "api_key");
        String query = req.getQueryString();
        String url = req.getRequestURL() + (query == null || query.isEmpty() ? "" : "?" + query);
        return new RenderRequest(templateId, slug, extension, params, url, apiKey, req.getHeader(HttpHeaders.REFERER));
    }

    private ResponseEntity<MemeUrlResponse> created(String url, boolean redirect) {
        if (redirect) {
            return ResponseEntity.status(HttpStatus.FOUND)
                    .location(URI.create(UrlUtils.withParam(url, "status", "201")))
                    .build();
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(new MemeUrlResponse(url));
    }

    private static String baseUrl() {
        return ServletUriComponentsBuilder.fromCurrentContextPath().build().toUriString();
    }
}
