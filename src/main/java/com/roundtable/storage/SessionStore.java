package com.roundtable.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.roundtable.AppLogger;
import com.roundtable.models.ChatSession;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Saves and restores chat sessions as JSON files in one directory.
 */
public class SessionStore {

    private static final DateTimeFormatter AUTOSAVE_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path sessionsDir;
    private final JsonStorage storage;
    private final AppLogger logger = AppLogger.get();

    public SessionStore(Path sessionsDir, JsonStorage storage) {
        this.sessionsDir = sessionsDir;
        this.storage = storage;
    }

    public Path getSessionsDir() {
        return sessionsDir;
    }

    /**
     * Write the session to {@code filename} (".json" is appended when missing).
     *
     * @return status text for the user
     */
    public String save(ChatSession session, String filename) throws IOException {
        if (session == null || !session.hasContent()) {
            return "Nothing to save - session is empty";
        }
        String name = normalizeFilename(filename);
        storage.write(resolve(name), session);
        return "Session saved to " + name;
    }

    /**
     * Save under a timestamped {@code autosave_yyyyMMdd_HHmmss.json} name.
     *
     * @return the file name used
     */
    public String autosave(ChatSession session) throws IOException {
        String name = "autosave_" + LocalDateTime.now().format(AUTOSAVE_FORMAT) + ".json";
        save(session, name);
        log("Session auto-saved to " + name);
        return name;
    }

    /**
     * Read a session. A file without history yields a fresh session; files written before round
     * table support (no mode, no roster) load as standard sessions with an empty roster.
     */
    public LoadedSession load(String filename) throws IOException {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("Session filename is required");
        }
        Path path = resolve(filename.trim());
        JsonNode data = storage.readTree(path);
        JsonNode history = data != null ? data.get("history") : null;
        if (history == null || !history.isArray() || history.isEmpty()) {
            return new LoadedSession(new ChatSession(), "Session file is empty or invalid");
        }
        ChatSession session = storage.convert(data, ChatSession.class);
        if (!session.isWellFormed()) {
            logWarn("Session " + filename + " has an unexpected message order");
        }
        return new LoadedSession(session, "Session loaded from " + filename.trim());
    }

    /**
     * Session files ordered by last modification time, newest first.
     */
    public List<String> listSessions() throws IOException {
        if (!Files.isDirectory(sessionsDir)) {
            return new ArrayList<>();
        }
        try (Stream<Path> files = Files.list(sessionsDir)) {
            List<Path> sessions = files
                .filter(p -> Files.isRegularFile(p) && p.getFileName().toString().endsWith(".json"))
                .collect(Collectors.toList());
            List<FileEntry> entries = new ArrayList<>();
            for (Path p : sessions) {
                entries.add(new FileEntry(p.getFileName().toString(), Files.getLastModifiedTime(p)));
            }
            entries.sort(Comparator.comparing((FileEntry e) -> e.modified).reversed()
                .thenComparing(e -> e.name));
            return entries.stream().map(e -> e.name).collect(Collectors.toList());
        }
    }

    private Path resolve(String filename) {
        Path path = sessionsDir.resolve(filename).normalize();
        if (!path.startsWith(sessionsDir.normalize())) {
            throw new SecurityException("Session file outside the sessions directory: " + filename);
        }
        return path;
    }

    private static String normalizeFilename(String filename) {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("Please enter a filename");
        }
        String name = filename.trim();
        return name.endsWith(".json") ? name : name + ".json";
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[SessionStore] " + message);
        }
    }

    private void logWarn(String message) {
        if (logger != null) {
            logger.warn("[SessionStore] " + message);
        }
    }

    private static final class FileEntry {
        private final String name;
        private final FileTime modified;

        private FileEntry(String name, FileTime modified) {
            this.name = name;
            this.modified = modified;
        }
    }
}
