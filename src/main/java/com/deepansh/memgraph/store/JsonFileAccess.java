package com.deepansh.memgraph.store;

import com.deepansh.memgraph.exception.MemoryStorageException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.function.Supplier;

/**
 * Reads and writes the workspace's JSON files.
 *
 * Reads never fail: a missing, unreadable or malformed file comes back as the
 * caller's empty value. Writes go to a sibling temp file first and are moved
 * into place, so a crash mid-write leaves the previous version intact.
 */
@Component
@Slf4j
public class JsonFileAccess {

    private final ObjectMapper objectMapper;

    public JsonFileAccess(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public <T> T read(Path file, TypeReference<T> type, Supplier<T> empty) {
        if (!Files.isRegularFile(file)) {
            log.debug("No file at {}, using empty value", file);
            return empty.get();
        }
        try {
            T value = objectMapper.readValue(file.toFile(), type);
            return value != null ? value : empty.get();
        } catch (IOException e) {
            log.warn("Could not read {} ({}), recovering as empty", file, e.getMessage());
            return empty.get();
        }
    }

    public void write(Path file, Object value) {
        try {
            Files.createDirectories(file.getParent());
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), value);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new MemoryStorageException("Failed to write " + file, e);
        }
    }
}
