package com.example.regulations.assistantservice.model;

/**
 * What the store remembers about a committed document for change detection.
 */
public record DocumentFingerprint(String checksum, String modelVersion) {}
