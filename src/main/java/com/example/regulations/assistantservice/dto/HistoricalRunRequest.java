package com.example.regulations.assistantservice.dto;

import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

public record HistoricalRunRequest(@NotNull LocalDate startDate, @NotNull LocalDate endDate) {}
