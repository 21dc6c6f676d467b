package com.deepansh.memgraph.salience;

import com.deepansh.memgraph.config.MemoryProperties;
import com.deepansh.memgraph.exception.EntityNotFoundException;
import com.deepansh.memgraph.exception.InvalidRequestException;
import com.deepansh.memgraph.exception.MemoryGraphException;
import com.deepansh.memgraph.model.EntityKey;
import com.deepansh.memgraph.model.Fact;
import com.deepansh.memgraph.store.FactStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Access tracking and salience ranking over the fact store.
 *
 * {@link #recordAccess} is the only writer of lastAccessed and accessCount.
 */
@Service
@Slf4j
public class SalienceService {

    private final FactStore factStore;
    private final SalienceScorer scorer;
    private final MemoryProperties properties;
    private final Clock clock;

    public SalienceService(FactStore factStore, SalienceScorer scorer,
                           MemoryProperties properties, Clock clock) {
        this.factStore = factStore;
        this.scorer = scorer;
        this.properties = properties;
        this.clock = clock;
    }

    public Fact recordAccess(EntityKey entity, String factId) {
        requireEntity(entity);
        List<Fact> facts = factStore.load(entity);
        Fact target = facts.stream()
                .filter(f -> factId != null && factId.equals(f.getId()))
                .findFirst()
                .orElseThrow(() -> new EntityNotFoundException("Fact '" + factId + "' not found for " + entity));

        target.setLastAccessed(LocalDateTime.now(clock).toString());
        target.setAccessCount(target.effectiveAccessCount() + 1);
        factStore.save(entity, facts);

        log.debug("Recorded access [entity={}, fact={}, count={}]", entity, factId, target.getAccessCount());
        return target;
    }

    public List<ScoredFact> rankByScore(EntityKey entity, Integer limit) {
        requireEntity(entity);
        return rank(factStore.load(entity), limit);
    }

    /**
     * Scores facts and sorts them highest first. The sort is stable, so equal
     * scores keep file order. Legacy facts score with lastAccessed = timestamp
     * and accessCount = 1.
     */
    public List<ScoredFact> rank(List<Fact> facts, Integer limit) {
        if (limit != null && limit < 1) {
            throw new InvalidRequestException("Limit must be >= 1, got " + limit);
        }
        List<ScoredFact> scored = new ArrayList<>(facts.size());
        for (Fact fact : facts) {
            scored.add(new ScoredFact(fact, score(fact)));
        }
        scored.sort(Comparator.comparingDouble(ScoredFact::salienceScore).reversed());
        return limit != null && limit < scored.size() ? scored.subList(0, limit) : scored;
    }

    public double score(Fact fact) {
        return scorer.score(fact.effectiveLastAccessed(), fact.effectiveAccessCount());
    }

    /**
     * Back-fills lastAccessed (from timestamp, else today) and accessCount (1)
     * on facts that predate access tracking. Files that fail are reported and skipped.
     */
    public MigrationReport migrate() {
        int files = 0;
        int updated = 0;
        List<String> errors = new ArrayList<>();
        String today = LocalDate.now(clock).toString();

        for (EntityKey entity : factStore.listEntities()) {
            files++;
            try {
                List<Fact> facts = factStore.load(entity);
                int changes = 0;
                for (Fact fact : facts) {
                    boolean modified = false;
                    if (fact.getLastAccessed() == null) {
                        fact.setLastAccessed(fact.getTimestamp() != null ? fact.getTimestamp() : today);
                        modified = true;
                    }
                    if (fact.getAccessCount() == null) {
                        fact.setAccessCount(Fact.DEFAULT_ACCESS_COUNT);
                        modified = true;
                    }
                    if (modified) changes++;
                }
                if (changes > 0) {
                    factStore.save(entity, facts);
                    updated += changes;
                }
            } catch (MemoryGraphException e) {
                log.warn("Salience migration failed for {}: {}", entity, e.getMessage());
                errors.add(entity + ": " + e.getMessage());
            }
        }

        log.info("Salience migration done [files={}, updated={}, errors={}]", files, updated, errors.size());
        return new MigrationReport(files, updated, errors);
    }

    public SalienceStats stats() {
        double high = properties.getSalience().getHighThreshold();
        double low = properties.getSalience().getLowThreshold();

        int total = 0;
        int withSalience = 0;
        int highCount = 0;
        int lowCount = 0;
        long accessSum = 0;
        double scoreSum = 0;
        double maxScore = 0;

        for (EntityKey entity : factStore.listEntities()) {
            for (Fact fact : factStore.load(entity)) {
                total++;
                if (!fact.hasSalienceData()) {
                    continue;
                }
                withSalience++;
                double score = scorer.score(fact.getLastAccessed(), fact.getAccessCount());
                accessSum += fact.getAccessCount();
                scoreSum += score;
                maxScore = Math.max(maxScore, score);
                if (score > high) {
                    highCount++;
                } else if (score < low) {
                    lowCount++;
                }
            }
        }

        double avgAccess = withSalience == 0 ? 0 : round((double) accessSum / withSalience, 2);
        double avgScore = withSalience == 0 ? 0 : round(scoreSum / withSalience, 4);
        return new SalienceStats(total, withSalience, avgAccess, avgScore, round(maxScore, 4), highCount, lowCount);
    }

    private void requireEntity(EntityKey entity) {
        if (!factStore.exists(entity)) {
            throw new EntityNotFoundException("Unknown entity: " + entity);
        }
    }

    private static double round(double value, int places) {
        double factor = Math.pow(10, places);
        return Math.round(value * factor) / factor;
    }
}
