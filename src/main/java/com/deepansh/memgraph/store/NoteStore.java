package com.deepansh.memgraph.store;

import com.deepansh.memgraph.model.Note;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Read-only access to the daily notes under memory/*.md, in filename order.
 */
@Component
@Slf4j
public class NoteStore {

    private static final String NOTE_SUFFIX = ".md";

    private final WorkspaceLayout layout;

    public NoteStore(WorkspaceLayout layout) {
        this.layout = layout;
    }

    public List<Note> listNotes() {
        Path dir = layout.notesDir();
        if (!Files.isDirectory(dir)) {
            return List.of();
        }

        List<Path> noteFiles;
        try (Stream<Path> children = Files.list(dir)) {
            noteFiles = children
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(NOTE_SUFFIX))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            log.warn("Could not list notes in {} ({})", dir, e.getMessage());
            return List.of();
        }

        List<Note> notes = new ArrayList<>(noteFiles.size());
        for (Path file : noteFiles) {
            try {
                String fileName = file.getFileName().toString();
                String date = fileName.substring(0, fileName.length() - NOTE_SUFFIX.length());
                notes.add(new Note(date, layout.relative(file), Files.readString(file, StandardCharsets.UTF_8)));
            } catch (IOException e) {
                log.warn("Could not read note {} ({}), skipping", file, e.getMessage());
            }
        }
        return notes;
    }
}
