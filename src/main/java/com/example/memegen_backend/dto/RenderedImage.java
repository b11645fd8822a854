package com.example.memegen_backend.dto;

import java.nio.file.Path;

public record RenderedImage(Path path, String extension, int statusCode) {}
