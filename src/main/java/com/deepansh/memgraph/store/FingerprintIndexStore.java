package com.deepansh.memgraph.store;

import com.deepansh.memgraph.exception.MemoryStorageException;
import com.deepansh.memgraph.model.IndexEntry;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted fingerprint index (.memory-hashes.json): fingerprint -> first-seen entry.
 * A derived cache; it can be dropped and rebuilt from the fact store at any time.
 */
@Component
@Slf4j
public class FingerprintIndexStore {

    private static final TypeReference<LinkedHashMap<String, IndexEntry>> INDEX = new TypeReference<>() {};

    private final WorkspaceLayout layout;
    private final JsonFileAccess files;

    public FingerprintIndexStore(WorkspaceLayout layout, JsonFileAccess files) {
        this.layout = layout;
        this.files = files;
    }

    public Map<String, IndexEntry> load() {
        Map<String, IndexEntry> index = files.read(layout.fingerprintIndexFile(), INDEX, LinkedHashMap::new);
        index.values().removeIf(e -> e == null);
        return index;
    }

    public void save(Map<String, IndexEntry> index) {
        files.write(layout.fingerprintIndexFile(), index);
    }

    public Path location() {
        return layout.fingerprintIndexFile();
    }

    public long sizeOnDisk() {
        try {
            Path file = layout.fingerprintIndexFile();
            return Files.isRegularFile(file) ? Files.size(file) : 0L;
        } catch (IOException e) {
            log.debug("Could not stat fingerprint index: {}", e.getMessage());
            return 0L;
        }
    }

    /** @return true if an index file existed and was removed */
    public boolean delete() {
        try {
            boolean deleted = Files.deleteIfExists(layout.fingerprintIndexFile());
            if (deleted) {
                log.info("Removed fingerprint index {}", layout.fingerprintIndexFile());
            }
            return deleted;
        } catch (IOException e) {
            throw new MemoryStorageException("Failed to delete " + layout.fingerprintIndexFile(), e);
        }
    }
}
