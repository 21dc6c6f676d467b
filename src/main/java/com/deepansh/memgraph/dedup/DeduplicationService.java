package com.deepansh.memgraph.dedup;

import com.deepansh.memgraph.config.MemoryProperties;
import com.deepansh.memgraph.exception.InvalidRequestException;
import com.deepansh.memgraph.model.EntityKey;
import com.deepansh.memgraph.model.Fact;
import com.deepansh.memgraph.model.IndexEntry;
import com.deepansh.memgraph.model.Note;
import com.deepansh.memgraph.store.FactStore;
import com.deepansh.memgraph.store.FingerprintIndexStore;
import com.deepansh.memgraph.store.NoteStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Exact-duplicate detection over a persisted fingerprint index.
 *
 * The index maps fingerprint -> first-seen entry and only grows; the
 * sole way to drop entries is {@link #rebuildIndex()} (or {@link #clean()}).
 */
@Service
@Slf4j
public class DeduplicationService {

    static final String SOURCE_ITEMS = "items.json";
    static final String SOURCE_NOTES = "daily_notes";
    static final String SOURCE_OTHER = "other";

    private final ContentNormalizer normalizer;
    private final FingerprintIndexStore indexStore;
    private final FactStore factStore;
    private final NoteStore noteStore;
    private final MemoryProperties properties;
    private final Clock clock;

    public DeduplicationService(ContentNormalizer normalizer,
                                FingerprintIndexStore indexStore,
                                FactStore factStore,
                                NoteStore noteStore,
                                MemoryProperties properties,
                                Clock clock) {
        this.normalizer = normalizer;
        this.indexStore = indexStore;
        this.factStore = factStore;
        this.noteStore = noteStore;
        this.properties = properties;
        this.clock = clock;
    }

    public DuplicateCheck checkDuplicate(String text) {
        requireText(text);
        String fingerprint = normalizer.fingerprint(text);
        IndexEntry entry = indexStore.load().get(fingerprint);
        if (entry == null) {
            return DuplicateCheck.unique(fingerprint);
        }
        log.debug("Duplicate content [fingerprint={}, firstSeen={}]", shortHash(fingerprint), entry.firstSeen());
        return new DuplicateCheck(true, fingerprint, entry.firstSeen(), entry.source());
    }

    /**
     * Records the text's fingerprint if it is not indexed yet.
     * Re-registering known content keeps the original firstSeen and source.
     */
    public String registerContent(String text, String source) {
        requireText(text);
        String fingerprint = normalizer.fingerprint(text);
        Map<String, IndexEntry> index = indexStore.load();
        if (index.containsKey(fingerprint)) {
            log.debug("Content already indexed [fingerprint={}]", shortHash(fingerprint));
            return fingerprint;
        }
        index.put(fingerprint, new IndexEntry(
                LocalDateTime.now(clock).toString(), source, normalizer.preview(text)));
        indexStore.save(index);
        log.info("Registered content [fingerprint={}, source={}]", shortHash(fingerprint), source);
        return fingerprint;
    }

    /**
     * Recomputes the index from scratch: active facts of every entity, then
     * every note paragraph. The first occurrence of a fingerprint is indexed;
     * every later one is reported as a duplicate.
     */
    public DuplicateReport rebuildIndex() {
        Map<String, IndexEntry> index = new LinkedHashMap<>();
        List<DuplicateEntry> duplicates = new ArrayList<>();
        int processed = 0;

        for (EntityKey entity : factStore.listEntities()) {
            String itemsSource = factStore.itemsSource(entity);
            for (Fact fact : factStore.load(entity)) {
                if (!fact.isActive() || fact.getFact() == null || fact.getFact().isBlank()) {
                    continue;
                }
                processed++;
                String firstSeen = fact.getTimestamp() != null
                        ? fact.getTimestamp()
                        : LocalDate.now(clock).toString();
                index(fact.getFact(), itemsSource, firstSeen, index, duplicates);
            }
        }

        int minLength = properties.getDedup().getMinParagraphLength();
        for (Note note : noteStore.listNotes()) {
            for (String paragraph : note.paragraphs()) {
                if (paragraph.length() < minLength) {
                    continue;
                }
                processed++;
                index(paragraph, note.path(), note.date(), index, duplicates);
            }
        }

        indexStore.save(index);
        log.info("Rebuilt fingerprint index [processed={}, duplicates={}, size={}]",
                processed, duplicates.size(), index.size());
        return new DuplicateReport(processed, duplicates, index.size());
    }

    public IndexStats stats() {
        Map<String, IndexEntry> index = indexStore.load();
        Map<String, Integer> bySourceType = new TreeMap<>();
        index.values().forEach(e -> bySourceType.merge(sourceType(e.source()), 1, Integer::sum));
        return new IndexStats(index.size(), bySourceType,
                indexStore.location().toString(), indexStore.sizeOnDisk());
    }

    /** Drops the persisted index. @return whether there was one */
    public boolean clean() {
        return indexStore.delete();
    }

    private void index(String content, String source, String firstSeen,
                       Map<String, IndexEntry> index, List<DuplicateEntry> duplicates) {
        String fingerprint = normalizer.fingerprint(content);
        IndexEntry existing = index.get(fingerprint);
        if (existing != null) {
            duplicates.add(new DuplicateEntry(
                    existing.source(), source, ContentNormalizer.truncate(content), fingerprint));
        } else {
            index.put(fingerprint, new IndexEntry(firstSeen, source, normalizer.preview(content)));
        }
    }

    static String sourceType(String source) {
        if (source == null) return SOURCE_OTHER;
        if (source.contains("items.json")) return SOURCE_ITEMS;
        if (source.contains(".md")) return SOURCE_NOTES;
        return SOURCE_OTHER;
    }

    private static void requireText(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidRequestException("Text to fingerprint must not be blank");
        }
    }

    private static String shortHash(String fingerprint) {
        return fingerprint.substring(0, 12);
    }
}
