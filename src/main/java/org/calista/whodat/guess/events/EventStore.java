package org.calista.whodat.guess.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.whodat.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Append-only JSONL journal of session events. One line per {@link GameEvent}.
 */
public final class EventStore {
    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path file;

    public EventStore(FileIO io, ObjectMapper mapper, Path file) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.file = Objects.requireNonNull(file, "file");
    }

    public synchronized void append(GameEvent e) throws IOException {
        Objects.requireNonNull(e, "event");
        io.appendJsonl(file, mapper.writeValueAsString(e));
    }

    /** Whole journal in write order; empty when nothing was journaled yet. */
    public synchronized List<GameEvent> readAll() throws IOException {
        if (!io.exists(file)) return List.of();
        List<String> lines = io.readJsonl(file);
        ArrayList<GameEvent> out = new ArrayList<>(lines.size());
        for (String line : lines) out.add(mapper.readValue(line, GameEvent.class));
        return out;
    }

    public Path file() {
        return file;
    }
}
