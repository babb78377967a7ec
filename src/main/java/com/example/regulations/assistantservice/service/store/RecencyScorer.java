package com.example.regulations.assistantservice.service.store;

import com.example.regulations.assistantservice.config.RagProperties;
import com.example.regulations.assistantservice.model.RetrievalResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;

/**
 * Adds a small, exponentially decaying bonus for newer documents so a superseding rule
 * outranks the text it replaced when their similarity is about the same.
 */
@Component
public class RecencyScorer {

    public static final Comparator<RetrievalResult> RANKING = Comparator
            .comparingDouble(RetrievalResult::score).reversed()
            .thenComparing(RetrievalResult::publicationDate, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(RetrievalResult::documentId, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparingInt(RetrievalResult::sequenceIndex);

    private final double weight;
    private final double halfLifeDays;
    private final Clock clock;

    public RecencyScorer(RagProperties properties, Clock clock) {
        this.weight = properties.getVector().getRecencyWeight();
        this.halfLifeDays = Math.max(1.0, properties.getVector().getRecencyHalfLifeDays());
        this.clock = clock;
    }

    public double score(double similarity, LocalDate publicationDate) {
        return similarity + boost(publicationDate);
    }

    double boost(LocalDate publicationDate) {
        if (publicationDate == null || weight <= 0) {
            return 0.0;
        }
        long ageDays = Math.max(0, ChronoUnit.DAYS.between(publicationDate, LocalDate.now(clock)));
        return weight * Math.pow(0.5, ageDays / halfLifeDays);
    }
}
