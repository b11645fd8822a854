package com.example.memegen_backend.dto;

/**
 * A possibly rewritten value and whether it differs from the input.
 */
public record Rewrite(String value, boolean changed) {
    public static Rewrite unchanged(String value) {
        return new Rewrite(value, false);
    }
}
