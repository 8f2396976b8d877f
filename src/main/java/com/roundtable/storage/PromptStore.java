package com.roundtable.storage;

import com.roundtable.AppLogger;
import com.roundtable.models.SystemPrompt;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads system prompts stored as {@code {"prompt": "..."}} JSON files.
 */
public class PromptStore {

    public static final String DEFAULT_PROMPT_FILE = "code_guru.json";

    private final Path promptsDir;
    private final JsonStorage storage;
    private final AppLogger logger = AppLogger.get();

    public PromptStore(Path promptsDir, JsonStorage storage) {
        this.promptsDir = promptsDir;
        this.storage = storage;
    }

    public String load(String filename) throws IOException {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("No prompt file selected");
        }
        Path path = promptsDir.resolve(filename.trim()).normalize();
        if (!path.startsWith(promptsDir.normalize())) {
            throw new SecurityException("Prompt file outside the prompts directory: " + filename);
        }
        SystemPrompt prompt = storage.convert(storage.readTree(path), SystemPrompt.class);
        if (prompt == null || prompt.getPrompt() == null) {
            throw new IOException("Prompt file " + filename + " has no \"prompt\" field");
        }
        return prompt.getPrompt();
    }

    public List<String> listPrompts() throws IOException {
        if (!Files.isDirectory(promptsDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(promptsDir)) {
            return files
                .map(p -> p.getFileName().toString())
                .filter(name -> name.endsWith(".json"))
                .sorted()
                .collect(Collectors.toList());
        }
    }

    /**
     * The prompt in {@value #DEFAULT_PROMPT_FILE}, or null when it is absent or unreadable.
     */
    public String loadDefaultPrompt() {
        if (!Files.exists(promptsDir.resolve(DEFAULT_PROMPT_FILE))) {
            return null;
        }
        try {
            return load(DEFAULT_PROMPT_FILE);
        } catch (IOException e) {
            if (logger != null) {
                logger.error("[PromptStore] Error loading default prompt: " + e.getMessage());
            }
            return null;
        }
    }
}
