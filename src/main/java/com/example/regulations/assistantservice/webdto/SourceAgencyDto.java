package com.example.regulations.assistantservice.webdto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SourceAgencyDto(
        String name,
        @JsonProperty("raw_name") String rawName,
        String slug
) {}
