package com.deepansh.memgraph.store;

import com.deepansh.memgraph.config.MemoryProperties;
import com.deepansh.memgraph.model.EntityKey;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * File layout of a memory workspace:
 *
 * <pre>
 * life/areas/&lt;type&gt;/&lt;name&gt;/items.json   fact list
 * life/areas/&lt;type&gt;/&lt;name&gt;/summary.md   optional summary
 * memory/&lt;yyyy-mm-dd&gt;.md                note documents
 * patterns.json                         relationships
 * .memory-hashes.json                   fingerprint index
 * </pre>
 */
@Component
public class WorkspaceLayout {

    static final String ITEMS_FILE = "items.json";
    static final String SUMMARY_FILE = "summary.md";

    private final Path root;

    @Autowired
    public WorkspaceLayout(MemoryProperties properties) {
        this(Paths.get(properties.getWorkspaceDir()));
    }

    public WorkspaceLayout(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path areasDir() {
        return root.resolve("life").resolve("areas");
    }

    public Path notesDir() {
        return root.resolve("memory");
    }

    public Path patternsFile() {
        return root.resolve("patterns.json");
    }

    public Path fingerprintIndexFile() {
        return root.resolve(".memory-hashes.json");
    }

    public Path entityDir(EntityKey key) {
        return areasDir().resolve(key.type()).resolve(key.name());
    }

    public Path itemsFile(EntityKey key) {
        return entityDir(key).resolve(ITEMS_FILE);
    }

    public Path summaryFile(EntityKey key) {
        return entityDir(key).resolve(SUMMARY_FILE);
    }

    /** Workspace-relative path with forward slashes, used as a stable source reference. */
    public String relative(Path path) {
        return root.relativize(path.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }
}
