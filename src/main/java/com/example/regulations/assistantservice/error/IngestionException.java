package com.example.regulations.assistantservice.error;

/**
 * Source API failure that survived all retries. Scoped to a single page.
 */
public class IngestionException extends RegulationsAssistantException {

    private final int page;

    public IngestionException(String message, int page, Throwable cause) {
        super(message, cause);
        this.page = page;
    }

    public int getPage() {
        return page;
    }
}
