package com.example.memegen_backend.service;

import com.example.memegen_backend.config.RenderSettings;
import com.example.memegen_backend.dto.ImageSize;
import com.example.memegen_backend.dto.RenderRequest;
import com.example.memegen_backend.dto.ResolvedJob;
import com.example.memegen_backend.model.Template;
import com.example.memegen_backend.service.Interfaces.TemplateService;
import com.example.memegen_backend.util.SlugCodec;
import com.example.memegen_backend.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Turns a canonical request into a {@link ResolvedJob}.
 * <p>
 * Exactly one branch picks the template and style: oversize text, custom background, or named
 * template. Size and extension are validated afterwards; a failure there sets 422 whatever the
 * branch decided, but never swaps in the error template.
 * The placeholder sentinel suppresses every escalation it is compared against.
 */
@Service
public class RenderPipeline {
    private static final Logger LOGGER = LoggerFactory.getLogger(RenderPipeline.class);

    static final String CUSTOM_ID = "custom";
    static final int OK = 200;
    static final int NOT_FOUND = 404;
    static final int URI_TOO_LONG = 414;
    static final int UNSUPPORTED_MEDIA_TYPE = 415;
    static final int UNPROCESSABLE = 422;

    private final TemplateService templates;
    private final TrackingService tracking;
    private final RenderSettings settings;

    public RenderPipeline(TemplateService templates, TrackingService tracking, RenderSettings settings) {
        this.templates = templates;
        this.tracking = tracking;
        this.settings = settings;
    }

    public ResolvedJob resolve(RenderRequest request, String watermark) {
        String slug = request.textSlug();
        List<String> lines = SlugCodec.decode(slug);
        tracking.track(lines, request.referer());

        Resolution r = new Resolution(initialStatus(request));

        if (hasOversizeSegment(slug)) {
            LOGGER.error("Slug too long: {}", slug);
            String truncated = truncate(slug) + "...";
            lines = SlugCodec.decode(truncated);
            r.template = templates.errorTemplate();
            r.style = settings.defaultStyle();
            r.fail(URI_TOO_LONG);
        } else if (CUSTOM_ID.equals(request.templateId())) {
            resolveCustom(request, r);
        } else {
            resolveNamed(request, r);
        }

        ImageSize size = parseSize(request, r);
        String extension = request.extension();
        if (!settings.isAllowedExtension(extension)) {
            LOGGER.error("Invalid extension: {}", extension);
            extension = settings.defaultExtension();
            r.invalid();
        }

        return new ResolvedJob(r.template, r.style, lines, watermark, extension, size, r.status);
    }

    private void resolveCustom(RenderRequest request, Resolution r) {
        Optional<String> backgroundKey = UrlUtils.argKey(request.params(), settings.backgroundKeys());
        if (backgroundKey.isEmpty()) {
            LOGGER.error("No image URL specified for custom template");
            r.template = templates.errorTemplate();
            r.style = settings.defaultStyle();
            r.fail(UNPROCESSABLE);
            return;
        }

        String url = request.param(backgroundKey.get());
        r.template = templates.createFromUrl(url);
        if (!templates.hasImage(r.template)) {
            LOGGER.error("Unable to download image URL: {}", url);
            r.template = templates.errorTemplate();
            if (!settings.isPlaceholder(url)) {
                r.fail(UNSUPPORTED_MEDIA_TYPE);
            }
        }

        // the key that carried the background cannot also carry the style
        List<String> styleKeys = new ArrayList<>(settings.styleKeys());
        styleKeys.remove(backgroundKey.get());
        String style = UrlUtils.arg(request.params(), styleKeys).orElse(settings.defaultStyle());
        if (!UrlUtils.schema(style)) {
            style = style.toLowerCase(Locale.ROOT);
        }
        r.style = style;
        checkStyle(r);
    }

    private void resolveNamed(RenderRequest request, Resolution r) {
        String id = request.templateId();
        Optional<Template> found = templates.findById(id).filter(templates::hasImage);
        if (found.isPresent()) {
            r.template = found.get();
        } else {
            LOGGER.error("No such template: {}", id);
            r.template = templates.errorTemplate();
            if (!settings.isPlaceholder(id)) {
                r.fail(NOT_FOUND);
            }
        }

        r.style = UrlUtils.arg(request.params(), settings.styleKeys()).orElse(settings.defaultStyle());
        checkStyle(r);
    }

    private void checkStyle(Resolution r) {
        if (templates.supportsStyle(r.template, r.style)) {
            return;
        }
        if (UrlUtils.schema(r.style)) {
            r.fail(UNSUPPORTED_MEDIA_TYPE);
        } else if (!settings.isPlaceholder(r.style)) {
            r.fail(UNPROCESSABLE);
        }
    }

    private ImageSize parseSize(RenderRequest request, Resolution r) {
        String rawWidth = UrlUtils.arg(request.params(), "0", "width");
        String rawHeight = UrlUtils.arg(request.params(), "0", "height");
        try {
            int width = Integer.parseInt(rawWidth.trim());
            int height = Integer.parseInt(rawHeight.trim());
            if (outOfRange(width) || outOfRange(height)) {
                throw new NumberFormatException("dimensions are out of range: (" + width + ", " + height + ")");
            }
            return new ImageSize(width, height);
        } catch (NumberFormatException e) {
            LOGGER.error("Invalid size: {}", e.getMessage());
            r.invalid();
            return ImageSize.UNSPECIFIED;
        }
    }

    private boolean outOfRange(int dimension) {
        return dimension < 0
                || (dimension > 0 && dimension < settings.minDimension())
                || dimension > settings.maxDimension();
    }

    private boolean hasOversizeSegment(String slug) {
        for (String part : slug.split("/", -1)) {
            if (part.getBytes(StandardCharsets.UTF_8).length > settings.maxSegmentBytes()) {
                return true;
            }
        }
        return false;
    }

    private String truncate(String slug) {
        int limit = settings.truncatedSlugLength();
        if (slug.codePointCount(0, slug.length()) <= limit) {
            return slug;
        }
        return slug.substring(0, slug.offsetByCodePoints(0, limit));
    }

    private int initialStatus(RenderRequest request) {
        String raw = UrlUtils.arg(request.params(), String.valueOf(OK), "status");
        try {
            int status = Integer.parseInt(raw.trim());
            if (status >= 100 && status <= 599) {
                return status;
            }
            LOGGER.warn("Ignoring out-of-range status override: {}", raw);
        } catch (NumberFormatException e) {
            LOGGER.warn("Ignoring non-numeric status override: {}", raw);
        }
        return OK;
    }

    /** Per-request scratch state of the cascade. */
    private static final class Resolution {
        Template template;
        String style;
        int status;

        Resolution(int status) {
            this.status = status;
        }

        void fail(int code) {
            status = code;
        }

        /** Post-branch validation failure; always reported as 422. */
        void invalid() {
            status = UNPROCESSABLE;
        }
    }
}
