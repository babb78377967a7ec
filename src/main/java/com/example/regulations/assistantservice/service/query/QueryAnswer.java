package com.example.regulations.assistantservice.service.query;

import com.example.regulations.assistantservice.model.SearchFilters;

import java.util.List;

public record QueryAnswer(
        String answer,
        List<Citation> citations,
        SearchFilters filters,
        int retrievedCount,
        int includedCount
) {}
