package com.example.memegen_backend.service;

import com.example.memegen_backend.config.RenderSettings;
import com.example.memegen_backend.dto.AutomaticMemeRequest;
import com.example.memegen_backend.dto.AutomaticMemeResponse;
import com.example.memegen_backend.dto.CustomMemeRequest;
import com.example.memegen_backend.dto.ExampleResponse;
import com.example.memegen_backend.dto.MemeCreateRequest;
import com.example.memegen_backend.dto.MemeUrlResponse;
import com.example.memegen_backend.dto.SearchResult;
import com.example.memegen_backend.model.Template;
import com.example.memegen_backend.service.Interfaces.TemplateService;
import com.example.memegen_backend.util.SlugCodec;
import com.example.memegen_backend.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Builds canonical image URLs for the JSON endpoints: example listings, meme creation and
 * search-backed creation. Search hits are tokenized like any other outgoing URL.
 */
@Service
public class MemeUrlService {
    private static final Logger LOGGER = LoggerFactory.getLogger(MemeUrlService.class);

    private final TemplateService templates;
    private final RenderSettings settings;
    private final SearchService search;
    private final AttributionService attribution;

    public MemeUrlService(TemplateService templates, RenderSettings settings, SearchService search,
                          AttributionService attribution) {
        this.templates = templates;
        this.settings = settings;
        this.search = search;
        this.attribution = attribution;
    }

    public List<ExampleResponse> examples(String baseUrl, String filter) {
        String query = filter == null ? "" : filter.trim().toLowerCase(Locale.ROOT);
        return templates.all().stream()
                .filter(t -> !t.getExample().isEmpty())
                .filter(t -> query.isEmpty() || matches(t, query))
                .map(t -> new ExampleResponse(
                        baseUrl + UrlUtils.build(CanonicalizationGate.textPath(t.getId(),
                                SlugCodec.encode(t.getExample()), settings.defaultExtension()), Map.of()),
                        t.getId()))
                .toList();
    }

    public String create(String baseUrl, MemeCreateRequest request) {
        if (request == null || request.templateId() == null || request.templateId().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "TEMPLATE_ID_REQUIRED");
        }
        Template template = templates.findById(request.templateId())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "TEMPLATE_NOT_FOUND"));

        Map<String, String> params = new LinkedHashMap<>();
        String style = request.style() == null ? null : request.style().stream()
                .filter(Objects::nonNull)
                .filter(s -> !s.isBlank())
                .findFirst()
                .orElse(null);
        if (style != null && !style.equals(settings.defaultStyle())) {
            params.put("style", style);
        }
        String path = CanonicalizationGate.textPath(template.getId(), SlugCodec.encode(request.textLines()),
                extensionOrDefault(request.extension()));
        return baseUrl + UrlUtils.build(path, params);
    }

    public String createCustom(String baseUrl, CustomMemeRequest request) {
        Map<String, String> params = new LinkedHashMap<>();
        if (request != null && request.background() != null && !request.background().isBlank()) {
            params.put("background", request.background().trim());
        }
        if (request != null && request.style() != null && !request.style().isBlank()
                && !request.style().equals(settings.defaultStyle())) {
            params.put("style", request.style());
        }
        List<String> lines = request == null ? List.of() : request.textLines();
        String extension = request == null ? null : request.extension();
        String path = CanonicalizationGate.textPath(RenderPipeline.CUSTOM_ID, SlugCodec.encode(lines),
                extensionOrDefault(extension));
        return baseUrl + UrlUtils.build(path, params);
    }

    /**
     * Picks the best search hit for a phrase.
     *
     * @throws ResponseStatusException 400 when {@code text} is missing, 404 when nothing matched.
     */
    public AutomaticMemeResponse automatic(AutomaticMemeRequest request, String apiKey) {
        if (request == null || request.text() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "TEXT_REQUIRED");
        }
        boolean safe = request.safe() == null || request.safe();
        List<SearchResult> results = search.search(request.text(), safe, null, apiKey);
        LOGGER.info("Found {} result(s) for '{}'", results.size(), request.text());
        if (results.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No results matched: " + request.text());
        }
        SearchResult top = results.get(0);
        LOGGER.info("Top result: {} ({})", top.imageUrl(), top.confidence());
        return new AutomaticMemeResponse(tokenized(top, apiKey), top.confidence());
    }

    /**
     * Popular custom memes whose text matches {@code filter}.
     *
     * @throws ResponseStatusException 404 when nothing matched.
     */
    public List<MemeUrlResponse> popularCustom(String filter, boolean safe, String apiKey) {
        String query = filter == null ? "" : filter.toLowerCase(Locale.ROOT);
        List<SearchResult> results = search.search(query, safe, SearchService.MODE_RESULTS, apiKey);
        LOGGER.info("Found {} custom result(s) for '{}'", results.size(), query);
        if (results.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No results matched: " + query);
        }
        return results.stream()
                .map(r -> new MemeUrlResponse(tokenized(r, apiKey)))
                .toList();
    }

    private String tokenized(SearchResult result, String apiKey) {
        return attribution.tokenize(result.imageUrl().trim(), apiKey).value();
    }

    private String extensionOrDefault(String extension) {
        if (extension == null || extension.isBlank()) {
            return settings.defaultExtension();
        }
        return extension.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean matches(Template template, String query) {
        if (template.getId().toLowerCase(Locale.ROOT).contains(query)
                || template.getName().toLowerCase(Locale.ROOT).contains(query)) {
            return true;
        }
        return template.getExample().stream()
                .anyMatch(line -> line.toLowerCase(Locale.ROOT).contains(query))
                || template.getKeywords().stream()
                .anyMatch(k -> k.toLowerCase(Locale.ROOT).contains(query));
    }
}
