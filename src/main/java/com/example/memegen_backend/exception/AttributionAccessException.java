package com.example.memegen_backend.exception;

public class AttributionAccessException extends RuntimeException {
    public AttributionAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
