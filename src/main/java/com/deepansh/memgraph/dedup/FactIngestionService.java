package com.deepansh.memgraph.dedup;

import com.deepansh.memgraph.exception.InvalidRequestException;
import com.deepansh.memgraph.model.EntityKey;
import com.deepansh.memgraph.model.Fact;
import com.deepansh.memgraph.model.FactStatus;
import com.deepansh.memgraph.store.FactStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The write path into the fact store.
 *
 * A candidate is stored only when both duplicate strategies clear it:
 * 1. exact fingerprint lookup in the global index
 * 2. fuzzy word-overlap against the entity's active facts
 *
 * The two are kept separate on purpose. The index spans every entity and
 * note; the overlap check is local to one entity and catches rephrasings.
 */
@Service
@Slf4j
public class FactIngestionService {

    private final FactStore factStore;
    private final DeduplicationService deduplicationService;
    private final NearDuplicateDetector nearDuplicateDetector;
    private final Clock clock;

    public FactIngestionService(FactStore factStore,
                                DeduplicationService deduplicationService,
                                NearDuplicateDetector nearDuplicateDetector,
                                Clock clock) {
        this.factStore = factStore;
        this.deduplicationService = deduplicationService;
        this.nearDuplicateDetector = nearDuplicateDetector;
        this.clock = clock;
    }

    public WriteOutcome addFact(EntityKey entity, FactDraft draft) {
        if (draft == null || draft.fact() == null || draft.fact().strip().length() < 3) {
            throw new InvalidRequestException("Fact text must be at least 3 characters");
        }
        String text = draft.fact().strip();

        DuplicateCheck check = deduplicationService.checkDuplicate(text);
        if (check.isDuplicate()) {
            log.info("Skipped duplicate fact for {} [firstSeen={}, source={}]",
                    entity, check.firstSeen(), check.originalSource());
            return new WriteOutcome(WriteOutcome.Status.DUPLICATE, null, check.fingerprint(), check.originalSource());
        }

        List<Fact> existing = factStore.load(entity);
        Optional<Fact> near = nearDuplicateDetector.findNearDuplicate(text, existing);
        if (near.isPresent()) {
            log.info("Skipped near-duplicate fact for {} [matches id={}]", entity, near.get().getId());
            return new WriteOutcome(WriteOutcome.Status.NEAR_DUPLICATE, near.get(), check.fingerprint(), near.get().getId());
        }

        String timestamp = draft.timestamp() != null && !draft.timestamp().isBlank()
                ? draft.timestamp()
                : LocalDate.now(clock).toString();

        Fact fact = Fact.builder()
                .id(newId())
                .fact(text)
                .category(draft.category())
                .type(draft.type())
                .timestamp(timestamp)
                .source(draft.source())
                .status(FactStatus.ACTIVE)
                .supersededBy(null)
                .lastAccessed(timestamp)
                .accessCount(Fact.DEFAULT_ACCESS_COUNT)
                .build();

        factStore.append(entity, fact);
        String fingerprint = deduplicationService.registerContent(text, factStore.itemsSource(entity));
        return new WriteOutcome(WriteOutcome.Status.ADDED, fact, fingerprint, null);
    }

    public List<Fact> listFacts(EntityKey entity) {
        return factStore.load(entity);
    }

    private static String newId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
