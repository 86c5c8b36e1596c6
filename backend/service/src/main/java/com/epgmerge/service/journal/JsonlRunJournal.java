package com.epgmerge.service.journal;

import com.epgmerge.core.bus.EventBus;
import com.epgmerge.core.events.Event;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Appends every run event to a JSON Lines file so a run can be inspected after the fact.
 */
public class JsonlRunJournal {
    private final Path file;

    public JsonlRunJournal(Path file) {
        this.file = file;
    }

    public void register(EventBus bus) {
        bus.subscribeAll(this::append);
    }

    public void append(Event event) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(
                    file,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
            )) {
                writer.write(EventCodec.toJsonLine(event));
                writer.newLine();
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed appending event to " + file, e);
        }
    }

    public List<Event> readAll() {
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            List<Event> events = new ArrayList<>();
            int lineNumber = 0;
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    events.add(EventCodec.fromJsonLine(line));
                } catch (RuntimeException decodeError) {
                    throw new IllegalStateException("Invalid journal entry at line " + lineNumber + " of " + file, decodeError);
                }
            }
            return events;
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading journal " + file, e);
        }
    }
}
