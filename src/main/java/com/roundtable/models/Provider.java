package com.roundtable.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The chat backends the engine can talk to.
 * Serialized by display label so session files stay readable.
 */
public enum Provider {
    ANTHROPIC("Anthropic"),
    OPENROUTER("OpenRouter"),
    OPENAI("OpenAI");

    private final String label;

    Provider(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Accepts either the display label ("OpenRouter") or the constant name ("OPENROUTER").
     */
    @JsonCreator
    public static Provider fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Provider is required");
        }
        String trimmed = value.trim();
        for (Provider provider : values()) {
            if (provider.label.equalsIgnoreCase(trimmed) || provider.name().equalsIgnoreCase(trimmed)) {
                return provider;
            }
        }
        throw new IllegalArgumentException("Unknown provider: " + value);
    }
}
