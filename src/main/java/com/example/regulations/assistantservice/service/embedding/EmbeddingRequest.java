package com.example.regulations.assistantservice.service.embedding;

import java.util.List;

public record EmbeddingRequest(List<String> texts, String modelVersion) {}
