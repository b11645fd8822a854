package com.example.memegen_backend.exception;

/**
 * Raised when the render engine cannot produce an image for a resolved job.
 */
public class RenderException extends RuntimeException {
    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
