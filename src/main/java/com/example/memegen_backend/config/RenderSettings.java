package com.example.memegen_backend.config;

import java.util.List;
import java.util.Objects;

/**
 * Immutable resolution settings handed to the pipeline.
 */
public record RenderSettings(List<String> allowedExtensions,
                             String defaultExtension,
                             String defaultStyle,
                             String placeholder,
                             String errorTemplateId,
                             int maxSegmentBytes,
                             int truncatedSlugLength,
                             int minDimension,
                             int maxDimension,
                             List<String> styleKeys,
                             List<String> backgroundKeys) {

    public static final RenderSettings DEFAULT = new MemeProperties().toRenderSettings();

    public RenderSettings {
        allowedExtensions = List.copyOf(allowedExtensions);
        styleKeys = List.copyOf(styleKeys);
        backgroundKeys = List.copyOf(backgroundKeys);
    }

    /** True when the value is the configured "intentionally blank" sentinel. */
    public boolean isPlaceholder(String value) {
        return value != null && Objects.equals(value, placeholder);
    }

    public boolean isAllowedExtension(String extension) {
        return extension != null && allowedExtensions.contains(extension);
    }
}
