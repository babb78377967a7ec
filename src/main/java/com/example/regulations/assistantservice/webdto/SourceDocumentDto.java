package com.example.regulations.assistantservice.webdto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;

public record SourceDocumentDto(
        @JsonProperty("document_number") String documentNumber,
        String title,
        @JsonProperty("abstract") String summary,
        @JsonProperty("publication_date") LocalDate publicationDate,
        List<SourceAgencyDto> agencies,
        String type,
        @JsonProperty("html_url") String htmlUrl,
        @JsonProperty("raw_text_url") String rawTextUrl,
        String revision,
        @JsonProperty("modified_at") OffsetDateTime modifiedAt
) {}
