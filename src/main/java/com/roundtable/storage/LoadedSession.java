package com.roundtable.storage;

import com.roundtable.models.ChatSession;

/**
 * A session read from disk together with the status text shown to the user.
 */
public class LoadedSession {
    private final ChatSession session;
    private final String status;

    public LoadedSession(ChatSession session, String status) {
        this.session = session;
        this.status = status;
    }

    public ChatSession getSession() {
        return session;
    }

    public String getStatus() {
        return status;
    }
}
