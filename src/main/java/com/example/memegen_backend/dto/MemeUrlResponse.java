package com.example.memegen_backend.dto;

public record MemeUrlResponse(String url) {}
