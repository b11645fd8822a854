package com.example.memegen_backend.engine.Interfaces;

import com.example.memegen_backend.dto.ImageSize;
import com.example.memegen_backend.model.Template;

import java.nio.file.Path;
import java.util.List;

/**
 * Produces an image file for a fully resolved job. Calls block and may be CPU-heavy;
 * callers dispatch them off the request thread.
 */
public interface MemeRenderEngine {
    Path render(Template template, List<String> lines, String watermark, String extension,
                String style, ImageSize size) throws Exception;
}
