package com.roundtable.session;

/**
 * One displayed exchange: a user turn and everything answered to it.
 */
public class TranscriptEntry {
    private final String user;
    private final String assistant;

    public TranscriptEntry(String user, String assistant) {
        this.user = user;
        this.assistant = assistant;
    }

    public String getUser() {
        return user;
    }

    public String getAssistant() {
        return assistant;
    }
}
