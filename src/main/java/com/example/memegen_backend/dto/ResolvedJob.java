package com.example.memegen_backend.dto;

import com.example.memegen_backend.model.Template;

import java.util.List;

/**
 * Output of the resolution cascade: everything the renderer needs plus the response status.
 */
public record ResolvedJob(Template template,
                          String style,
                          List<String> textLines,
                          String watermark,
                          String extension,
                          ImageSize size,
                          int statusCode) {

    public ResolvedJob {
        textLines = textLines == null ? List.of() : List.copyOf(textLines);
        watermark = watermark == null ? "" : watermark;
        size = size == null ? ImageSize.UNSPECIFIED : size;
    }
}
