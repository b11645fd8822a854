package com.example.memegen_backend.dto;

public record ExampleResponse(String url, String template) {}
