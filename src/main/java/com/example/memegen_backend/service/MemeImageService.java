package com.example.memegen_backend.service;

import com.example.memegen_backend.dto.GateDecision;
import com.example.memegen_backend.dto.Redirect;
import com.example.memegen_backend.dto.RenderRequest;
import com.example.memegen_backend.dto.RenderedImage;
import com.example.memegen_backend.dto.ResolvedJob;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Request flow for image routes: canonicalization gate, resolution cascade, then the render pool.
 */
@Service
public class MemeImageService {

    private final CanonicalizationGate gate;
    private final RenderPipeline pipeline;
    private final ImageRenderService renderService;

    public MemeImageService(CanonicalizationGate gate, RenderPipeline pipeline, ImageRenderService renderService) {
        this.gate = gate;
        this.pipeline = pipeline;
        this.renderService = renderService;
    }

    /** {@code GET /images/{templateId}.{extension}}: background only, no text or watermark. */
    public CompletableFuture<ResponseEntity<Resource>> templateBackground(RenderRequest request) {
        Optional<Redirect> redirect = gate.checkTemplateRoute(request);
        if (redirect.isPresent()) {
            return CompletableFuture.completedFuture(redirectResponse(redirect.get()));
        }
        ResolvedJob job = pipeline.resolve(request, "");
        return renderService.render(job).thenApply(MemeImageService::imageResponse);
    }

    /** {@code GET /images/{templateId}/{textPath}.{extension}}: full gate, then render. */
    public CompletableFuture<ResponseEntity<Resource>> textImage(RenderRequest request) {
        GateDecision decision = gate.checkTextRoute(request);
        Optional<Redirect> redirect = decision.redirectOpt();
        if (redirect.isPresent()) {
            return CompletableFuture.completedFuture(redirectResponse(redirect.get()));
        }
        ResolvedJob job = pipeline.resolve(request, decision.watermark());
        return renderService.render(job).thenApply(MemeImageService::imageResponse);
    }

    static ResponseEntity<Resource> redirectResponse(Redirect redirect) {
        return ResponseEntity.status(redirect.status())
                .location(URI.create(redirect.location()))
                .build();
    }

    static ResponseEntity<Resource> imageResponse(RenderedImage image) {
        FileSystemResource resource = new FileSystemResource(image.path());
        return ResponseEntity.status(image.statusCode())
                .contentType(mediaTypeFor(image.extension()))
                .cacheControl(CacheControl.maxAge(1, TimeUnit.DAYS))
                .header(HttpHeaders.CONTENT_DISPOSITION, "inline; filename=\"" + image.path().getFileName() + "\"")
                .body(resource);
    }

    static MediaType mediaTypeFor(String extension) {
        return switch (extension) {
            case "jpg", "jpeg" -> MediaType.IMAGE_JPEG;
            case "gif" -> MediaType.IMAGE_GIF;
            case "png" -> MediaType.IMAGE_PNG;
            default -> MediaType.parseMediaType("image/" + extension);
        };
    }
}
