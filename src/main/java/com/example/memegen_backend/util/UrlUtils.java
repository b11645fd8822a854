package com.example.memegen_backend.util;

import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Query-parameter lookup and URL rebuilding helpers shared by the canonicalization gate
 * and the resolution cascade.
 */
public final class UrlUtils {
    private UrlUtils() {}

    private static final Pattern SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://.+");

    /**
     * Ordered lookup over candidate keys: the first key with a non-blank value wins.
     */
    public static Optional<String> arg(Map<String, String> params, List<String> keys) {
        if (params == null || keys == null) {
            return Optional.empty();
        }
        for (String key : keys) {
            String value = params.get(key);
            if (value != null && !value.isBlank()) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /** Same as {@link #arg(Map, List)} with a fallback when no key is present. */
    public static String arg(Map<String, String> params, String defaultValue, String... keys) {
        return arg(params, List.of(keys)).orElse(defaultValue);
    }

    /** Key of the first candidate that {@link #arg(Map, List)} would pick, if any. */
    public static Optional<String> argKey(Map<String, String> params, List<String> keys) {
        if (params == null || keys == null) {
            return Optional.empty();
        }
        return keys.stream()
                .filter(key -> params.get(key) != null && !params.get(key).isBlank())
                .findFirst();
    }

    /** True when the value carries a URL scheme such as {@code https://}. */
    public static boolean schema(String value) {
        return value != null && SCHEME.matcher(value.trim()).matches();
    }

    /**
     * Builds a relative URL from a path and query parameters, dropping blank parameters and
     * a dangling {@code ?}.
     */
    public static String build(String path, Map<String, String> params) {
        MultiValueMap<String, String> query = new LinkedMultiValueMap<>();
        if (params != null) {
            params.forEach((key, value) -> {
                if (key != null && !key.isBlank() && value != null && !value.isBlank()) {
                    query.add(key, value);
                }
            });
        }
        UriComponents uri = UriComponentsBuilder.fromPath(path)
                .queryParams(query)
                .build()
                .encode();
        return uri.toUriString();
    }

    public static boolean hasParam(String url, String name) {
        return UriComponentsBuilder.fromUriString(url).build().getQueryParams().containsKey(name);
    }

    /** Removes one query parameter from an absolute or relative URL. */
    public static String withoutParam(String url, String name) {
        return UriComponentsBuilder.fromUriString(url)
                .replaceQueryParam(name)
                .build()
                .toUriString();
    }

    /** Appends or replaces a query parameter on an absolute or relative URL. */
    public static String withParam(String url, String name, String value) {
        return UriComponentsBuilder.fromUriString(url)
                .replaceQueryParam(name, value)
                .build()
                .toUriString();
    }
}
