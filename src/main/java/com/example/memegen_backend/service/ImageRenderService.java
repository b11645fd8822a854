package com.example.memegen_backend.service;

import com.example.memegen_backend.dto.RenderedImage;
import com.example.memegen_backend.dto.ResolvedJob;
import com.example.memegen_backend.engine.Interfaces.MemeRenderEngine;
import com.example.memegen_backend.exception.RenderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Hands resolved jobs to the render engine on the render pool so request threads never run
 * image composition.
 */
@Service
public class ImageRenderService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ImageRenderService.class);

    private final MemeRenderEngine renderEngine;
    private final Executor renderExecutor;

    public ImageRenderService(MemeRenderEngine renderEngine,
                              @Qualifier("renderTaskExecutor") Executor renderExecutor) {
        this.renderEngine = renderEngine;
        this.renderExecutor = renderExecutor;
    }

    public CompletableFuture<RenderedImage> render(ResolvedJob job) {
        return CompletableFuture.supplyAsync(() -> renderNow(job), renderExecutor);
    }

    private RenderedImage renderNow(ResolvedJob job) {
        try {
            Path path = renderEngine.render(job.template(), job.textLines(), job.watermark(),
                    job.extension(), job.style(), job.size());
            return new RenderedImage(path, extensionOf(path, job.extension()), job.statusCode());
        } catch (Exception e) {
            LOGGER.error("Render failed template={} style={} ext={}: {}",
                    job.template().getId(), job.style(), job.extension(), e.toString(), e);
            throw new RenderException("Render failed for template " + job.template().getId(), e);
        }
    }

    /** The engine may substitute a format it can encode; the file name is authoritative. */
    private static String extensionOf(Path path, String requested) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? requested : name.substring(dot + 1);
    }
}
