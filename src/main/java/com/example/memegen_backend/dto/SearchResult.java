package com.example.memegen_backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One hit from the remote meme search.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SearchResult(@JsonProperty("image_url") String imageUrl, double confidence) {}
