package com.example.regulations.assistantservice.model;

public record Agency(String id, String name) {}
