package com.example.regulations.assistantservice.service.ingest;

import com.example.regulations.assistantservice.webdto.SourcePageDto;

import java.time.LocalDate;

/**
 * Raw access to the upstream document API. Implementations throw on any transport or HTTP
 * failure; retrying is up to the caller.
 */
public interface DocumentSource {

    /**
     * @param end inclusive upper bound, or null for open-ended
     * @param page 1-based page number
     */
    SourcePageDto fetchPage(LocalDate start, LocalDate end, int page);

    String fetchFullText(String url);
}
