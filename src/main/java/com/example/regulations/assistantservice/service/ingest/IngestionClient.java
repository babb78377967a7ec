// src/main/java/com/example/regulations/assistantservice/service/ingest/IngestionClient.java
package com.example.regulations.assistantservice.service.ingest;

import com.example.regulations.assistantservice.config.RagProperties;
import com.example.regulations.assistantservice.error.IngestionException;
import com.example.regulations.assistantservice.model.DocumentFingerprint;
import com.example.regulations.assistantservice.model.RegulatoryDocument;
import com.example.regulations.assistantservice.service.support.Hashing;
import com.example.regulations.assistantservice.service.support.TransientFailures;
import com.example.regulations.assistantservice.webdto.SourceAgencyDto;
import com.example.regulations.assistantservice.webdto.SourceDocumentDto;
import com.example.regulations.assistantservice.webdto.SourcePageDto;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Pulls documents from the upstream API page by page and maps them to {@link RegulatoryDocument}s.
 * <p>
 * Each page is retried with exponential backoff on transient errors. A page that still fails is
 * handed back as a failed {@link SourcePage} so the caller can carry on with the rest.
 */
@Slf4j
@Component
public class IngestionClient {

    static final int MAX_TITLE_LENGTH = 1000;
    static final int MAX_TYPE_LENGTH = 50;
    static final String UNKNOWN_AGENCY_ID = "unknown";
    static final String UNKNOWN_AGENCY_NAME = "Unknown";

    private static final Pattern TAGS = Pattern.compile("<[^>]+>");
    private static final Pattern NON_SLUG = Pattern.compile("[^a-z0-9]+");

    private final DocumentSource source;
    private final Retry retry;
    private final Retry fullTextRetry;
    private final Duration pageDelay;
    private final boolean fetchFullText;
    private final Clock clock;

    public IngestionClient(DocumentSource source, RagProperties properties, Clock clock) {
        RagProperties.Source cfg = properties.getSource();
        this.source = source;
        this.pageDelay = cfg.getPageDelay();
        this.fetchFullText = cfg.isFetchFullText();
        this.clock = clock;
        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(Math.max(1, cfg.getMaxAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(cfg.getInitialBackoff(), cfg.getBackoffMultiplier()))
                .retryOnException(TransientFailures::isTransient)
                .build();
        this.retry = Retry.of("source-page", retryConfig);
        this.fullTextRetry = Retry.of("source-full-text", retryConfig);
        logRetries(retry);
        logRetries(fullTextRetry);
    }

    private static void logRetries(Retry retry) {
        retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying {} (attempt {}): {}", retry.getName(), event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() == null ? "unknown" : event.getLastThrowable().toString()));
    }

    /**
     * Documents published on or after {@code cursor}.
     */
    public SourcePageSequence fetchSince(LocalDate cursor) {
        return new SourcePageSequence(this, cursor, null, 1);
    }

    /**
     * Documents published between {@code start} and {@code end}, both inclusive.
     */
    public SourcePageSequence fetchBetween(LocalDate start, LocalDate end) {
        if (end != null && end.isBefore(start)) {
            throw new IllegalArgumentException("end " + end + " is before start " + start);
        }
        return new SourcePageSequence(this, start, end, 1);
    }

    /**
     * @return true when the candidate is new, its content changed, or it was embedded with another model
     */
    public boolean needsProcessing(RegulatoryDocument candidate, DocumentFingerprint stored, String modelVersion) {
        if (stored == null) {
            return true;
        }
        if (!stored.checksum().equals(candidate.getChecksum())) {
            return true;
        }
        return modelVersion != null && !modelVersion.equals(stored.modelVersion());
    }

    /**
     * Maps a source record. Records without a document number or title are skipped.
     *
     * @throws RuntimeException when full text is enabled and its download still fails after retries;
     *         the record must not be stored with a substitute body
     */
    public Optional<RegulatoryDocument> toDocument(SourceDocumentDto dto) {
        if (dto == null || isBlank(dto.documentNumber()) || isBlank(dto.title())) {
            return Optional.empty();
        }
        String title = truncate(dto.title().strip(), MAX_TITLE_LENGTH);
        String body = bodyOf(dto);
        String text = body.isEmpty() ? title : title + "\n\n" + body;

        SourceAgencyDto agency = dto.agencies() == null || dto.agencies().isEmpty() ? null : dto.agencies().get(0);
        String agencyName = agencyName(agency);
        String agencyId = agencyId(agency, agencyName);
        String type = dto.type() == null ? "" : truncate(dto.type(), MAX_TYPE_LENGTH);
        Instant now = clock.instant();

        return Optional.of(RegulatoryDocument.builder()
                .sourceId(dto.documentNumber().strip())
                .title(title)
                .agencyId(agencyId)
                .agencyName(agencyName)
                .documentType(type)
                .publicationDate(dto.publicationDate())
                .text(text)
                .checksum(checksum(title, agencyId, dto.publicationDate(), text))
                .revision(dto.revision())
                .sourceUrl(dto.htmlUrl())
                .lastFetchedAt(now)
                .lastModifiedAt(dto.modifiedAt() == null ? now : dto.modifiedAt().toInstant())
                .build());
    }

    SourcePage fetchPage(LocalDate start, LocalDate end, int page) {
        SourcePageDto dto;
        try {
            dto = Retry.decorateCallable(retry, () -> source.fetchPage(start, end, page)).call();
        } catch (Exception e) {
            log.error("Source page {} failed after retries: {}", page, e.getMessage());
            return SourcePage.failed(page, null, new IngestionException("Failed to fetch page " + page, page, e));
        }
        List<SourceDocumentDto> records = dto == null || dto.results() == null ? List.of() : dto.results();
        List<RegulatoryDocument> documents = new ArrayList<>(records.size());
        int skipped = 0;
        int failed = 0;
        for (SourceDocumentDto record : records) {
            Optional<RegulatoryDocument> doc;
            try {
                doc = toDocument(record);
            } catch (RuntimeException e) {
                log.error("Dropping {} from page {}, full text unavailable: {}", record.documentNumber(), page,
                        e.getMessage());
                failed++;
                continue;
            }
            if (doc.isPresent()) {
                documents.add(doc.get());
            } else {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.warn("Skipped {} records without document number or title on page {}", skipped, page);
        }
        Integer totalPages = dto == null ? null : dto.totalPages();
        log.info("Fetched page {}/{} ({} documents)", page, totalPages == null ? "?" : totalPages, documents.size());
        return new SourcePage(page, totalPages, documents, skipped, failed, null);
    }

    /**
     * Sleeps for the configured delay between pages.
     *
     * @return false if interrupted
     */
    boolean pause() {
        if (pageDelay.isZero() || pageDelay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(pageDelay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    static String checksum(String title, String agencyId, LocalDate publicationDate, String text) {
        return Hashing.sha256(title + "|" + agencyId + "|" + publicationDate + "|" + text);
    }

    static String slugify(String name) {
        String slug = NON_SLUG.matcher(name.toLowerCase(Locale.ROOT)).replaceAll("-");
        return slug.replaceAll("^-+|-+$", "");
    }

    private String bodyOf(SourceDocumentDto dto) {
        String summary = dto.summary() == null ? "" : dto.summary().strip();
        if (!fetchFullText || isBlank(dto.rawTextUrl())) {
            return summary;
        }
        String raw = Retry.decorateSupplier(fullTextRetry, () -> source.fetchFullText(dto.rawTextUrl())).get();
        String plain = raw == null ? "" : HtmlUtils.htmlUnescape(TAGS.matcher(raw).replaceAll(" ")).strip();
        return plain.isEmpty() ? summary : plain;
    }

    private static String agencyName(SourceAgencyDto agency) {
        if (agency == null) {
            return UNKNOWN_AGENCY_NAME;
        }
        if (!isBlank(agency.name())) {
            return agency.name().strip();
        }
        return isBlank(agency.rawName()) ? UNKNOWN_AGENCY_NAME : agency.rawName().strip();
    }

    private static String agencyId(SourceAgencyDto agency, String agencyName) {
        if (agency != null && !isBlank(agency.slug())) {
            return agency.slug().strip().toLowerCase(Locale.ROOT);
        }
        String slug = slugify(agencyName);
        return slug.isEmpty() ? UNKNOWN_AGENCY_ID : slug;
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
