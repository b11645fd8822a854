package com.example.memegen_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings for request resolution: extension whitelist, defaults, placeholder sentinel,
 * watermark policy and the optional remote attribution endpoint.
 */
@ConfigurationProperties(prefix = "memegen")
public class MemeProperties {

    private List<String> allowedExtensions = new ArrayList<>(List.of("gif", "jpg", "png", "webp"));
    private String defaultExtension = "png";
    private String defaultStyle = "default";
    private String placeholder = "string";
    private String errorTemplateId = "_error";
    private int maxSegmentBytes = 200;
    private int truncatedSlugLength = 50;
    private int minDimension = 10;
    private int maxDimension = 2000;
    private List<String> styleKeys = new ArrayList<>(List.of("style", "alt"));
    private List<String> backgroundKeys = new ArrayList<>(List.of("background", "alt"));

    private String defaultWatermark = "Memegen.link";
    private List<String> allowedWatermarks = new ArrayList<>();
    private List<String> apiKeys = new ArrayList<>();

    private String remoteTrackingUrl;
    private int tokenizeTimeoutSeconds = 3;

    public List<String> getAllowedExtensions() { return allowedExtensions; }
    public void setAllowedExtensions(List<String> allowedExtensions) { this.allowedExtensions = allowedExtensions; }

    public String getDefaultExtension() { return defaultExtension; }
    public void setDefaultExtension(String defaultExtension) { this.defaultExtension = defaultExtension; }

    public String getDefaultStyle() { return defaultStyle; }
    public void setDefaultStyle(String defaultStyle) { this.defaultStyle = defaultStyle; }

    public String getPlaceholder() { return placeholder; }
    public void setPlaceholder(String placeholder) { this.placeholder = placeholder; }

    public String getErrorTemplateId() { return errorTemplateId; }
    public void setErrorTemplateId(String errorTemplateId) { this.errorTemplateId = errorTemplateId; }

    public int getMaxSegmentBytes() { return maxSegmentBytes; }
    public void setMaxSegmentBytes(int maxSegmentBytes) { this.maxSegmentBytes = maxSegmentBytes; }

    public int getTruncatedSlugLength() { return truncatedSlugLength; }
    public void setTruncatedSlugLength(int truncatedSlugLength) { this.truncatedSlugLength = truncatedSlugLength; }

    public int getMinDimension() { return minDimension; }
    public void setMinDimension(int minDimension) { this.minDimension = minDimension; }

    public int getMaxDimension() { return maxDimension; }
    public void setMaxDimension(int maxDimension) { this.maxDimension = maxDimension; }

    public List<String> getStyleKeys() { return styleKeys; }
    public void setStyleKeys(List<String> styleKeys) { this.styleKeys = styleKeys; }

    public List<String> getBackgroundKeys() { return backgroundKeys; }
    public void setBackgroundKeys(List<String> backgroundKeys) { this.backgroundKeys = backgroundKeys; }

    public String getDefaultWatermark() { return defaultWatermark; }
    public void setDefaultWatermark(String defaultWatermark) { this.defaultWatermark = defaultWatermark; }

    public List<String> getAllowedWatermarks() { return allowedWatermarks; }
    public void setAllowedWatermarks(List<String> allowedWatermarks) { this.allowedWatermarks = allowedWatermarks; }

    public List<String> getApiKeys() { return apiKeys; }
    public void setApiKeys(List<String> apiKeys) { this.apiKeys = apiKeys; }

    public String getRemoteTrackingUrl() { return remoteTrackingUrl; }
    public void setRemoteTrackingUrl(String remoteTrackingUrl) { this.remoteTrackingUrl = remoteTrackingUrl; }

    public int getTokenizeTimeoutSeconds() { return tokenizeTimeoutSeconds; }
    public void setTokenizeTimeoutSeconds(int tokenizeTimeoutSeconds) { this.tokenizeTimeoutSeconds = tokenizeTimeoutSeconds; }

    /**
     * Snapshots the mutable binding into the immutable value the pipeline consumes.
     *
     * @return settings for {@link com.example.memegen_backend.service.RenderPipeline}.
     */
    public RenderSettings toRenderSettings() {
        return new RenderSettings(
                List.copyOf(allowedExtensions),
                defaultExtension,
                defaultStyle,
                placeholder,
                errorTemplateId,
                maxSegmentBytes,
                truncatedSlugLength,
                minDimension,
                maxDimension,
                List.copyOf(styleKeys),
                List.copyOf(backgroundKeys)
        );
    }
}
