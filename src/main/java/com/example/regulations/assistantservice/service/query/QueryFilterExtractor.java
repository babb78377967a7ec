package com.example.regulations.assistantservice.service.query;

import com.example.regulations.assistantservice.config.RagProperties;
import com.example.regulations.assistantservice.model.Agency;
import com.example.regulations.assistantservice.model.SearchFilters;
import com.example.regulations.assistantservice.service.store.VectorStore;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls agency and publication-date restrictions out of a free-text question.
 * <p>
 * Agencies are recognised by configured alias (EPA), by id (environmental-protection-agency) or
 * by display name of any agency already in the store. Dates understand ISO days, bare years,
 * {@code since/after/from}, {@code before/until}, {@code between .. and ..} and
 * {@code last N days|weeks|months|years}. Extraction never throws; anything it cannot read is
 * simply not used as a filter.
 */
@Slf4j
@Component
public class QueryFilterExtractor {

    private static final String DATE = "(\\d{4}-\\d{2}-\\d{2}|(?:19|20)\\d{2})";
    private static final Pattern BETWEEN = Pattern.compile("\\b(?:between|from)\\s+" + DATE + "\\s+(?:and|to|through|until)\\s+" + DATE + "\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern LOWER = Pattern.compile("\\b(since|after|from)\\s+" + DATE + "\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern UPPER = Pattern.compile("\\b(before|until|through)\\s+" + DATE + "\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern RELATIVE = Pattern.compile("\\b(?:last|past)\\s+(\\d+\\s+)?(day|week|month|year)s?\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern ISO_DAY = Pattern.compile("\\b(\\d{4}-\\d{2}-\\d{2})\\b");
    private static final Pattern YEAR = Pattern.compile("\\b((?:19|20)\\d{2})\\b");
    private static final String AGENCIES_KEY = "agencies";

    private final Map<String, String> aliases;
    private final VectorStore vectorStore;
    private final Clock clock;
    private final Cache<String, List<Agency>> knownAgencies = Caffeine.newBuilder()
            .expireAfterWrite(Duration.ofMinutes(10))
            .maximumSize(1)
            .build();

    public QueryFilterExtractor(RagProperties properties, VectorStore vectorStore, Clock clock) {
        this.aliases = properties.getQuery().getAgencyAliases();
        this.vectorStore = vectorStore;
        this.clock = clock;
    }

    public Optional<SearchFilters> extract(String question) {
        if (question == null || question.isBlank()) {
            return Optional.empty();
        }
        try {
            SearchFilters filters = SearchFilters.none();
            String agency = agencyOf(question);
            if (agency != null) {
                filters = filters.withAgency(agency);
            }
            LocalDate[] range = dateRangeOf(question);
            if (range != null) {
                filters = filters.withRange(range[0], range[1]);
            }
            return filters.isEmpty() ? Optional.empty() : Optional.of(filters);
        } catch (RuntimeException e) {
            log.warn("Filter extraction failed for question, searching unfiltered: {}", e.toString());
            return Optional.empty();
        }
    }

    String agencyOf(String question) {
        String lower = question.toLowerCase(Locale.ROOT);
        String best = null;
        int bestLength = 0;
        for (Map.Entry<String, String> alias : aliases.entrySet()) {
            if (containsWord(lower, alias.getKey().toLowerCase(Locale.ROOT)) && alias.getKey().length() > bestLength) {
                best = alias.getValue();
                bestLength = alias.getKey().length();
            }
        }
        for (Agency agency : agencies()) {
            if (agency.id() != null && agency.id().length() > bestLength && containsWord(lower, agency.id().toLowerCase(Locale.ROOT))) {
                best = agency.id();
                bestLength = agency.id().length();
            }
            if (agency.name() != null && agency.name().length() > bestLength && containsWord(lower, agency.name().toLowerCase(Locale.ROOT))) {
                best = agency.id();
                bestLength = agency.name().length();
            }
        }
        return best;
    }

    LocalDate[] dateRangeOf(String question) {
        Matcher m = BETWEEN.matcher(question);
        if (m.find()) {
            LocalDate from = startOf(m.group(1));
            LocalDate to = endOf(m.group(2));
            if (from != null && to != null) {
                return from.isAfter(to) ? new LocalDate[]{to, from} : new LocalDate[]{from, to};
            }
        }
        LocalDate from = null;
        LocalDate to = null;
        m = LOWER.matcher(question);
        if (m.find()) {
            boolean exclusive = m.group(1).equalsIgnoreCase("after");
            from = exclusive ? afterOf(m.group(2)) : startOf(m.group(2));
        }
        m = UPPER.matcher(question);
        if (m.find()) {
            boolean exclusive = m.group(1).equalsIgnoreCase("before");
            to = exclusive ? beforeOf(m.group(2)) : endOf(m.group(2));
        }
        if (from != null || to != null) {
            return new LocalDate[]{from, to};
        }
        m = RELATIVE.matcher(question);
        if (m.find()) {
            int n = m.group(1) == null ? 1 : Integer.parseInt(m.group(1).trim());
            LocalDate today = LocalDate.now(clock);
            LocalDate start = switch (m.group(2).toLowerCase(Locale.ROOT)) {
                case "day" -> today.minusDays(n);
                case "week" -> today.minusWeeks(n);
                case "month" -> today.minusMonths(n);
                default -> today.minusYears(n);
            };
            return new LocalDate[]{start, today};
        }
        m = ISO_DAY.matcher(question);
        if (m.find()) {
            LocalDate day = parseDay(m.group(1));
            if (day != null) {
                return new LocalDate[]{day, day};
            }
        }
        m = YEAR.matcher(question);
        if (m.find()) {
            int year = Integer.parseInt(m.group(1));
            return new LocalDate[]{LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31)};
        }
        return null;
    }

    private List<Agency> agencies() {
        try {
            return knownAgencies.get(AGENCIES_KEY, k -> vectorStore.agencies());
        } catch (RuntimeException e) {
            log.debug("Agency list unavailable, using aliases only: {}", e.getMessage());
            return List.of();
        }
    }

    private static boolean containsWord(String haystack, String needle) {
        if (needle.isBlank()) {
            return false;
        }
        return Pattern.compile("(?<![\\w-])" + Pattern.quote(needle) + "(?![\\w-])").matcher(haystack).find();
    }

    private static LocalDate startOf(String token) {
        return token.length() == 4 ? LocalDate.of(Integer.parseInt(token), 1, 1) : parseDay(token);
    }

    private static LocalDate endOf(String token) {
        return token.length() == 4 ? LocalDate.of(Integer.parseInt(token), 12, 31) : parseDay(token);
    }

    private static LocalDate afterOf(String token) {
        LocalDate end = endOf(token);
        return end == null ? null : end.plusDays(1);
    }

    private static LocalDate beforeOf(String token) {
        LocalDate start = startOf(token);
        return start == null ? null : start.minusDays(1);
    }

    private static LocalDate parseDay(String token) {
        try {
            return LocalDate.parse(token);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
