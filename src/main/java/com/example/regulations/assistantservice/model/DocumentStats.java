package com.example.regulations.assistantservice.model;

import java.time.LocalDate;
import java.util.List;

public record DocumentStats(
        long totalDocuments,
        long totalChunks,
        List<TypeCount> documentTypes,
        List<DayCount> recentActivity
) {
    public record TypeCount(String type, long count) {}
    public record DayCount(LocalDate date, long count) {}
}
