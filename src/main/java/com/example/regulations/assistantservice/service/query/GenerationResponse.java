package com.example.regulations.assistantservice.service.query;

public record GenerationResponse(String text, String model) {}
