package com.roundtable.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Conversation state: system prompt, message log, round table roster and chat mode.
 * Owned by a single writer; not thread-safe.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"system", "history", "round_table", "mode"})
public class ChatSession {

    public static final String DEFAULT_SYSTEM_PROMPT = "You are a helpful assistant. Explain in depth.";

    private String system = DEFAULT_SYSTEM_PROMPT;
    private final List<Message> history = new ArrayList<>();
    private RoundTableConfig roundTable = new RoundTableConfig();
    private ChatMode mode = ChatMode.STANDARD;

    public ChatSession() {}

    public ChatSession(String system) {
        setSystem(system);
    }

    public String getSystem() {
        return system;
    }

    public void setSystem(String system) {
        this.system = system != null ? system : "";
    }

    public List<Message> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public void setHistory(List<Message> history) {
        this.history.clear();
        if (history != null) {
            this.history.addAll(history);
        }
    }

    @JsonProperty("round_table")
    public RoundTableConfig getRoundTable() {
        return roundTable;
    }

    @JsonProperty("round_table")
    public void setRoundTable(RoundTableConfig roundTable) {
        this.roundTable = roundTable != null ? roundTable : new RoundTableConfig();
    }

    public ChatMode getMode() {
        return mode;
    }

    public void setMode(ChatMode mode) {
        this.mode = mode != null ? mode : ChatMode.STANDARD;
    }

    public void addMessage(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("Message is required");
        }
        history.add(message);
    }

    public void addMessages(List<Message> messages) {
        for (Message message : messages) {
            addMessage(message);
        }
    }

    public void clearHistory() {
        history.clear();
    }

    @JsonIgnore
    public boolean hasContent() {
        return !history.isEmpty();
    }

    /**
     * Checks the conversation shape: the log starts with a user message and never has two user
     * messages in a row. Several assistant messages in a row are fine (round table answers).
     */
    @JsonIgnore
    public boolean isWellFormed() {
        if (history.isEmpty()) {
            return true;
        }
        if (!history.get(0).isUser()) {
            return false;
        }
        for (int i = 1; i < history.size(); i++) {
            if (history.get(i).isUser() && history.get(i - 1).isUser()) {
                return false;
            }
        }
        return true;
    }
}
