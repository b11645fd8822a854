package com.example.memegen_backend.dto;

public record AutomaticMemeResponse(String url, double confidence) {}
