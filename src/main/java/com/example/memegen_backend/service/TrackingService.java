package com.example.memegen_backend.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * One-way submission of rendered text to the tracking pool. Nothing is returned to the caller
 * and a slow or failing task never affects the response that triggered it.
 */
@Service
public class TrackingService {
    private static final Logger LOGGER = LoggerFactory.getLogger(TrackingService.class);

    private final Executor trackingExecutor;

    public TrackingService(@Qualifier("trackingTaskExecutor") Executor trackingExecutor) {
        this.trackingExecutor = trackingExecutor;
    }

    public void track(List<String> lines, String referer) {
        String text = lines == null ? "" : lines.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.joining(" "));
        if (text.isEmpty()) {
            return;
        }
        try {
            trackingExecutor.execute(() -> deliver(text, referer));
        } catch (RejectedExecutionException ex) {
            LOGGER.warn("Tracking queue full; dropped text of length {}", text.length());
        }
    }

    private void deliver(String text, String referer) {
        // delivery to an analytics backend is not wired; the record only reaches the log
        LOGGER.debug("Tracked text='{}' referer={}", text, referer);
    }
}
