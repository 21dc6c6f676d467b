package com.deepansh.memgraph.store;

import com.deepansh.memgraph.model.EntityKey;
import com.deepansh.memgraph.model.Fact;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * File-backed, per-entity ordered fact lists.
 *
 * Facts are appended and never removed; supersession only flips status.
 * Entity walk order is lexicographic by path (type, then name) so every
 * batch pass over the store sees facts in the same order.
 */
@Component
@Slf4j
public class FactStore {

    private static final TypeReference<List<Fact>> FACT_LIST = new TypeReference<>() {};

    private final WorkspaceLayout layout;
    private final JsonFileAccess files;

    public FactStore(WorkspaceLayout layout, JsonFileAccess files) {
        this.layout = layout;
        this.files = files;
    }

    /** Every entity that has an items.json, in lexicographic path order. */
    public List<EntityKey> listEntities() {
        Path areas = layout.areasDir();
        if (!Files.isDirectory(areas)) {
            return List.of();
        }
        List<EntityKey> entities = new ArrayList<>();
        for (Path typeDir : sortedSubdirectories(areas)) {
            for (Path entityDir : sortedSubdirectories(typeDir)) {
                if (Files.isRegularFile(entityDir.resolve(WorkspaceLayout.ITEMS_FILE))) {
                    entities.add(new EntityKey(
                            typeDir.getFileName().toString(),
                            entityDir.getFileName().toString()));
                }
            }
        }
        log.debug("Found {} entities under {}", entities.size(), areas);
        return entities;
    }

    public boolean exists(EntityKey key) {
        return Files.isRegularFile(layout.itemsFile(key));
    }

    /** Facts of one entity in file order; missing or corrupt files read as empty. */
    public List<Fact> load(EntityKey key) {
        List<Fact> facts = files.read(layout.itemsFile(key), FACT_LIST, ArrayList::new);
        facts.removeIf(f -> f == null);
        return facts;
    }

    public void save(EntityKey key, List<Fact> facts) {
        files.write(layout.itemsFile(key), facts);
        log.debug("Saved {} facts for {}", facts.size(), key);
    }

    public void append(EntityKey key, Fact fact) {
        List<Fact> facts = load(key);
        facts.add(fact);
        save(key, facts);
        log.info("Appended fact [id={}] to {}", fact.getId(), key);
    }

    public Optional<Fact> find(EntityKey key, String factId) {
        return load(key).stream()
                .filter(f -> factId.equals(f.getId()))
                .findFirst();
    }

    public Optional<String> readSummary(EntityKey key) {
        Path summary = layout.summaryFile(key);
        if (!Files.isRegularFile(summary)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(summary, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Could not read summary for {} ({}), skipping", key, e.getMessage());
            return Optional.empty();
        }
    }

    /** Source reference for a fact, e.g. {@code life/areas/people/john/items.json#a1b2c3d4}. */
    public String sourceOf(EntityKey key, String factId) {
        return itemsSource(key) + "#" + (factId == null ? "" : factId);
    }

    public String itemsSource(EntityKey key) {
        return layout.relative(layout.itemsFile(key));
    }

    private List<Path> sortedSubdirectories(Path dir) {
        try (Stream<Path> children = Files.list(dir)) {
            return children.filter(Files::isDirectory)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            log.warn("Could not list {} ({}), skipping", dir, e.getMessage());
            return List.of();
        }
    }
}
