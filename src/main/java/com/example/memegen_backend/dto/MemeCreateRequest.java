package com.example.memegen_backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record MemeCreateRequest(
        @JsonProperty("template_id") String templateId,
        @JsonProperty("text_lines") List<String> textLines,
        List<String> style,
        String extension,
        Boolean redirect
) {}
