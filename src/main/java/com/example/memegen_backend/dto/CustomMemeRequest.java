package com.example.memegen_backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record CustomMemeRequest(
        @Size(max = 2048) String background,
        String style,
        @JsonProperty("text_lines") List<String> textLines,
        String extension,
        Boolean redirect
) {}
