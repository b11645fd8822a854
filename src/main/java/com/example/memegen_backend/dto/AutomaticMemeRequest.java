package com.example.memegen_backend.dto;

public record AutomaticMemeRequest(String text, Boolean safe, Boolean redirect) {}
