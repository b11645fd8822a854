package com.example.memegen_backend.service;

import com.example.memegen_backend.dto.GateDecision;
import com.example.memegen_backend.dto.Redirect;
import com.example.memegen_backend.dto.RenderRequest;
import com.example.memegen_backend.dto.Rewrite;
import com.example.memegen_backend.util.SlugCodec;
import com.example.memegen_backend.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

/**
 * Decides, before any rendering work, whether the inbound URL is canonical.
 * <p>
 * Checks run in a fixed order and the first redirect wins. Template backgrounds only get the
 * animated-style rewrite; text images additionally get slug normalization, tokenization and
 * the watermark check.
 */
@Service
public class CanonicalizationGate {
    private static final Logger LOGGER = LoggerFactory.getLogger(CanonicalizationGate.class);
    public static final String ROUTE_PREFIX = "/images";
    static final String ANIMATED = "animated";
    static final String GIF = "gif";

    private final AttributionService attribution;

    public CanonicalizationGate(AttributionService attribution) {
        this.attribution = attribution;
    }

    public Optional<Redirect> checkTemplateRoute(RenderRequest request) {
        if (wantsAnimatedRewrite(request)) {
            String location = UrlUtils.build(templatePath(request.templateId(), GIF), request.paramsWithout("style"));
            LOGGER.info("Animated style redirect template={} -> {}", request.templateId(), location);
            return Optional.of(Redirect.permanent(location));
        }
        return Optional.empty();
    }

    public GateDecision checkTextRoute(RenderRequest request) {
        String id = request.templateId();
        String ext = request.extension();

        if (wantsAnimatedRewrite(request)) {
            String location = UrlUtils.build(textPath(id, request.textSlug(), GIF), request.paramsWithout("style"));
            LOGGER.info("Animated style redirect template={} -> {}", id, location);
            return GateDecision.redirectTo(Redirect.permanent(location));
        }

        Rewrite slug = SlugCodec.normalize(request.textSlug());
        if (slug.changed()) {
            String location = UrlUtils.build(textPath(id, slug.value(), ext), request.params());
            LOGGER.info("Normalized slug redirect '{}' -> {}", request.textSlug(), location);
            return GateDecision.redirectTo(Redirect.permanent(location));
        }

        if (request.url() != null) {
            Rewrite tokenized = attribution.tokenize(request.url(), request.apiKey());
            if (tokenized.changed()) {
                LOGGER.info("Tokenized redirect -> {}", tokenized.value());
                return GateDecision.redirectTo(Redirect.temporary(tokenized.value()));
            }
        }

        Rewrite watermark = attribution.resolveWatermark(request);
        if (watermark.changed()) {
            Map<String, String> params = request.paramsWithout("watermark");
            String location = UrlUtils.build(textPath(id, slug.value(), ext), params);
            LOGGER.info("Watermark redirect -> {}", location);
            return GateDecision.redirectTo(Redirect.temporary(location));
        }

        return GateDecision.proceed(watermark.value());
    }

    private boolean wantsAnimatedRewrite(RenderRequest request) {
        return ANIMATED.equals(request.param("style")) && !GIF.equals(request.extension());
    }

    public static String templatePath(String templateId, String extension) {
        return ROUTE_PREFIX + "/" + templateId + "." + extension;
    }

    public static String textPath(String templateId, String slug, String extension) {
        return ROUTE_PREFIX + "/" + templateId + "/" + slug + "." + extension;
    }
}
