package com.roundtable.storage;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Shared JSON file access for the session and prompt stores.
 */
public class JsonStorage {

    private final ObjectMapper mapper;

    public JsonStorage(ObjectMapper mapper) {
        this.mapper = mapper.copy().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public JsonNode readTree(Path path) throws IOException {
        return mapper.readTree(path.toFile());
    }

    public <T> T convert(JsonNode node, Class<T> type) throws IOException {
        return mapper.treeToValue(node, type);
    }

    public void write(Path path, Object data) throws IOException {
        Path parent = path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), data);
    }
}
