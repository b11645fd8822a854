package com.example.memegen_backend.dto;

/**
 * Canonicalization decision: answer with {@code Location} instead of an image.
 */
public record Redirect(String location, int status) {
    public static Redirect permanent(String location) {
        return new Redirect(location, 301);
    }

    public static Redirect temporary(String location) {
        return new Redirect(location, 302);
    }
}
