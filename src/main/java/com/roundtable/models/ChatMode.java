package com.roundtable.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ChatMode {
    STANDARD("Standard Chat"),
    ROUND_TABLE("Round Table");

    private final String label;

    ChatMode(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static ChatMode fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return STANDARD;
        }
        String trimmed = value.trim();
        for (ChatMode mode : values()) {
            if (mode.label.equalsIgnoreCase(trimmed) || mode.name().equalsIgnoreCase(trimmed)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown chat mode: " + value);
    }
}
