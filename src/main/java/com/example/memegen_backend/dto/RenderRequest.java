package com.example.memegen_backend.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One inbound image request, as read from the path and query string.
 *
 * @param templateId template identifier, possibly {@code "custom"}
 * @param textSlug   encoded overlay text, empty for template backgrounds
 * @param extension  requested file extension, not yet validated
 * @param params     first value of every query parameter, in request order
 * @param url        full request URL including the query string
 * @param apiKey     caller credential from header or query, may be {@code null}
 * @param referer    Referer header, may be {@code null}
 */
public record RenderRequest(String templateId,
                            String textSlug,
                            String extension,
                            Map<String, String> params,
                            String url,
                            String apiKey,
                            String referer) {

    public RenderRequest {
        Objects.requireNonNull(templateId, "templateId");
        textSlug = textSlug == null ? "" : textSlug;
        extension = extension == null ? "" : extension;
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public String param(String name) {
        return params.get(name);
    }

    /** Query parameters without {@code name}, preserving order. */
    public Map<String, String> paramsWithout(String name) {
        Map<String, String> copy = new LinkedHashMap<>(params);
        copy.remove(name);
        return copy;
    }
}
