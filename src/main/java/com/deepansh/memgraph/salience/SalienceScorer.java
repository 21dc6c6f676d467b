package com.deepansh.memgraph.salience;

import com.deepansh.memgraph.config.MemoryProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Time-and-frequency decay score for a fact.
 *
 * <pre>
 * recency   = 0                              if days >= window
 *             exp(-days / (window / 3))      otherwise
 * frequency = ln(accessCount + 1)
 * score     = recency * frequency
 * </pre>
 *
 * A lastAccessed value that does not parse scores a flat 0.1 recency
 * instead of failing the whole ranking.
 */
@Component
@Slf4j
public class SalienceScorer {

    static final double UNPARSABLE_RECENCY = 0.1;

    private final Clock clock;
    private final int decayWindowDays;

    public SalienceScorer(Clock clock, MemoryProperties properties) {
        this.clock = clock;
        this.decayWindowDays = properties.getSalience().getDecayWindowDays();
    }

    public double score(String lastAccessed, int accessCount) {
        return recencyWeight(lastAccessed) * frequencyWeight(accessCount);
    }

    public double recencyWeight(String lastAccessed) {
        return recencyWeight(lastAccessed, decayWindowDays);
    }

    public double recencyWeight(String lastAccessed, int maxDays) {
        LocalDate date = parseDate(lastAccessed);
        if (date == null) {
            return UNPARSABLE_RECENCY;
        }
        // accesses stamped in the future count as today
        long days = Math.max(0, ChronoUnit.DAYS.between(date, LocalDate.now(clock)));
        if (days >= maxDays) {
            return 0.0;
        }
        return Math.exp(-days / (maxDays / 3.0));
    }

    public double frequencyWeight(int accessCount) {
        return Math.log(Math.max(0, accessCount) + 1);
    }

    /** Date part of an ISO date or date-time ("2026-02-01", "2026-02-01T09:30:00"). */
    static LocalDate parseDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.strip();
        int cut = value.indexOf('T');
        if (cut < 0) {
            cut = value.indexOf(' ');
        }
        String datePart = cut > 0 ? value.substring(0, cut) : value;
        try {
            return LocalDate.parse(datePart);
        } catch (DateTimeParseException e) {
            log.debug("Unparsable access date '{}', using low default weight", raw);
            return null;
        }
    }
}
