package com.example.regulations.assistantservice.model;

import java.time.LocalDate;

/**
 * Optional metadata restrictions applied to a vector search. Every field may be null.
 */
public record SearchFilters(String agencyId, LocalDate publishedFrom, LocalDate publishedTo) {

    private static final SearchFilters NONE = new SearchFilters(null, null, null);

    public static SearchFilters none() {
        return NONE;
    }

    public static SearchFilters agency(String agencyId) {
        return new SearchFilters(agencyId, null, null);
    }

    public boolean isEmpty() {
        return agencyId == null && publishedFrom == null && publishedTo == null;
    }

    public boolean matches(String documentAgencyId, LocalDate publicationDate) {
        if (agencyId != null && !agencyId.equalsIgnoreCase(documentAgencyId)) {
            return false;
        }
        if (publishedFrom != null && (publicationDate == null || publicationDate.isBefore(publishedFrom))) {
            return false;
        }
        return publishedTo == null || (publicationDate != null && !publicationDate.isAfter(publishedTo));
    }

    public SearchFilters withAgency(String id) {
        return new SearchFilters(id, publishedFrom, publishedTo);
    }

    public SearchFilters withRange(LocalDate from, LocalDate to) {
        return new SearchFilters(agencyId, from, to);
    }
}
