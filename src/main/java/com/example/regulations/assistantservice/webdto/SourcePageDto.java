package com.example.regulations.assistantservice.webdto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SourcePageDto(
        Integer count,
        @JsonProperty("total_pages") Integer totalPages,
        @JsonProperty("next_page_url") String nextPageUrl,
        List<SourceDocumentDto> results
) {}
