package com.example.memegen_backend.dto;

/**
 * Requested output dimensions; 0 means "use the template's own size".
 */
public record ImageSize(int width, int height) {
    public static final ImageSize UNSPECIFIED = new ImageSize(0, 0);
}
