package com.example.regulations.assistantservice.service.ingest;

import com.example.regulations.assistantservice.error.IngestionException;
import com.example.regulations.assistantservice.model.RegulatoryDocument;

import java.util.List;

/**
 * One page of source results, already mapped to documents. A failed page carries the error
 * that survived all retries and no documents.
 *
 * @param totalPages page count reported by the source, null when unknown
 * @param skippedRecords records dropped for missing identifier or title
 * @param failedRecords records dropped because their full text could not be downloaded
 */
public record SourcePage(int page,
                         Integer totalPages,
                         List<RegulatoryDocument> documents,
                         int skippedRecords,
                         int failedRecords,
                         IngestionException error) {

    public static SourcePage failed(int page, Integer totalPages, IngestionException error) {
        return new SourcePage(page, totalPages, List.of(), 0, 0, error);
    }

    public boolean succeeded() {
        return error == null;
    }
}
