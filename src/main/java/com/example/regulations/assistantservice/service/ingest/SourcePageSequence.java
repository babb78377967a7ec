package com.example.regulations.assistantservice.service.ingest;

import com.example.regulations.assistantservice.error.IngestionException;

import java.time.LocalDate;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazy walk over the source's pages for a publication-date window. Nothing is fetched until
 * iteration starts, each {@link #iterator()} starts over, and {@link #fromPage(int)} restarts
 * at a given page.
 * <p>
 * Iteration stops after the last page the source reports, after an empty page, or after a
 * failed page when the total is still unknown.
 */
public final class SourcePageSequence implements Iterable<SourcePage> {

    private final IngestionClient client;
    private final LocalDate start;
    private final LocalDate end;
    private final int firstPage;

    SourcePageSequence(IngestionClient client, LocalDate start, LocalDate end, int firstPage) {
        this.client = client;
        this.start = start;
        this.end = end;
        this.firstPage = Math.max(1, firstPage);
    }

    public SourcePageSequence fromPage(int page) {
        return new SourcePageSequence(client, start, end, page);
    }

    public LocalDate start() {
        return start;
    }

    public LocalDate end() {
        return end;
    }

    @Override
    public Iterator<SourcePage> iterator() {
        return new Iterator<>() {
            private int next = firstPage;
            private Integer totalPages;
            private boolean done;

            @Override
            public boolean hasNext() {
                return !done && (totalPages == null || next <= totalPages);
            }

            @Override
            public SourcePage next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                if (next > firstPage && !client.pause()) {
                    done = true;
                    return SourcePage.failed(next, totalPages,
                            new IngestionException("Interrupted before page " + next, next, null));
                }
                SourcePage page = client.fetchPage(start, end, next);
                if (page.totalPages() != null) {
                    totalPages = page.totalPages();
                }
                if (page.succeeded() && page.documents().isEmpty()
                        && page.skippedRecords() == 0 && page.failedRecords() == 0) {
                    done = true;
                }
                if (!page.succeeded() && totalPages == null) {
                    done = true;
                }
                next++;
                return page;
            }
        };
    }
}
