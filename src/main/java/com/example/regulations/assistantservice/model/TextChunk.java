package com.example.regulations.assistantservice.model;

/**
 * A chunker output segment. Offsets are character positions in the source text,
 * end exclusive; spans of neighbouring chunks overlap but never leave a gap.
 */
public record TextChunk(int sequenceIndex, String text, int startOffset, int endOffset, int tokenCount) {}
