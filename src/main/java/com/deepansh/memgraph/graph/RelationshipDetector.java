package com.deepansh.memgraph.graph;

import com.deepansh.memgraph.model.EntityKey;
import com.deepansh.memgraph.model.Fact;
import com.deepansh.memgraph.model.Note;
import com.deepansh.memgraph.model.Relationship;
import com.deepansh.memgraph.store.FactStore;
import com.deepansh.memgraph.store.NoteStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Derives edges from fact text and notes.
 *
 * Three passes, in this order:
 * 1. typed: a fact containing a relation verb ("works at") links its entity
 *    to every other entity the fact names
 * 2. mentions: a fact naming another entity links to it as "mentions"
 * 3. co_mentioned: entities named in the same note are linked pairwise
 *
 * Passes 2 and 3 ignore names of three characters or fewer.
 * The combined list is deduplicated on (from, to, relation), first wins.
 */
@Component
@Slf4j
public class RelationshipDetector {

    static final List<String> RELATION_VERBS =
            List.of("works_at", "knows", "uses", "manages", "leads", "founded");

    static final int MENTION_MIN_NAME_LENGTH = 4;

    private final FactStore factStore;
    private final NoteStore noteStore;
    private final MentionExtractorFactory extractorFactory;
    private final Clock clock;

    public RelationshipDetector(FactStore factStore,
                                NoteStore noteStore,
                                MentionExtractorFactory extractorFactory,
                                Clock clock) {
        this.factStore = factStore;
        this.noteStore = noteStore;
        this.extractorFactory = extractorFactory;
        this.clock = clock;
    }

    public List<Relationship> detect() {
        List<EntityKey> entities = factStore.listEntities();
        MentionExtractor anyName = extractorFactory.forEntities(entities, 1);
        MentionExtractor longNames = extractorFactory.forEntities(entities, MENTION_MIN_NAME_LENGTH);
        String today = LocalDate.now(clock).toString();

        log.info("Scanning for relationships among {} entities", entities.size());
        List<Relationship> detected = new ArrayList<>();

        for (EntityKey entity : entities) {
            for (Fact fact : factStore.load(entity)) {
                if (!fact.isActive() || fact.getFact() == null) {
                    continue;
                }
                String text = fact.getFact().toLowerCase(Locale.ROOT);
                String since = fact.getTimestamp() != null ? fact.getTimestamp() : today;
                String source = factStore.sourceOf(entity, fact.getId());

                for (String verb : RELATION_VERBS) {
                    if (!text.contains(verb.replace('_', ' '))) {
                        continue;
                    }
                    for (EntityKey other : anyName.extract(text)) {
                        if (!other.equals(entity)) {
                            detected.add(new Relationship(entity.toString(), other.toString(), verb, since, source));
                        }
                    }
                }

                for (EntityKey other : longNames.extract(text)) {
                    if (!other.equals(entity)) {
                        detected.add(new Relationship(
                                entity.toString(), other.toString(), Relationship.MENTIONS, since, source));
                    }
                }
            }
        }

        for (Note note : noteStore.listNotes()) {
            List<EntityKey> mentioned = new ArrayList<>(longNames.extract(note.content()));
            for (int i = 0; i < mentioned.size(); i++) {
                for (int j = i + 1; j < mentioned.size(); j++) {
                    detected.add(new Relationship(mentioned.get(i).toString(), mentioned.get(j).toString(),
                            Relationship.CO_MENTIONED, note.date(), note.path()));
                }
            }
        }

        List<Relationship> unique = deduplicate(detected);
        log.info("Detected {} unique relationships ({} before dedup)", unique.size(), detected.size());
        return unique;
    }

    static List<Relationship> deduplicate(List<Relationship> relationships) {
        Map<String, Relationship> unique = new LinkedHashMap<>();
        relationships.forEach(r -> unique.putIfAbsent(r.dedupKey(), r));
        return new ArrayList<>(unique.values());
    }
}
