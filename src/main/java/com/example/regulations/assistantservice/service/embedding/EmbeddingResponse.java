package com.example.regulations.assistantservice.service.embedding;

import java.util.List;

/**
 * Vectors in request order, plus what the service says about the model that produced them.
 */
public record EmbeddingResponse(String modelVersion, int dimension, List<float[]> vectors) {}
