package com.example.memegen_backend.dto;

import java.util.Optional;

/**
 * Outcome of the canonicalization checks: either a redirect, or the watermark to render with.
 */
public record GateDecision(Redirect redirect, String watermark) {

    public static GateDecision proceed(String watermark) {
        return new GateDecision(null, watermark == null ? "" : watermark);
    }

    public static GateDecision redirectTo(Redirect redirect) {
        return new GateDecision(redirect, "");
    }

    public Optional<Redirect> redirectOpt() {
        return Optional.ofNullable(redirect);
    }
}
