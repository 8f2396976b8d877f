package com.roundtable.session;

import com.roundtable.models.Message;

import java.util.List;

/**
 * Outcome of one submitted user turn.
 */
public class TurnResult {

    private final boolean processed;
    private final List<Message> appended;
    private final String error;

    private TurnResult(boolean processed, List<Message> appended, String error) {
        this.processed = processed;
        this.appended = appended;
        this.error = error;
    }

    static TurnResult ignored() {
        return new TurnResult(false, List.of(), null);
    }

    static TurnResult success(List<Message> appended) {
        return new TurnResult(true, List.copyOf(appended), null);
    }

    static TurnResult failure(String error) {
        return new TurnResult(true, List.of(), error);
    }

    /**
     * False when the input was blank and nothing happened.
     */
    public boolean isProcessed() {
        return processed;
    }

    public boolean isSuccess() {
        return processed && error == null;
    }

    /**
     * Assistant messages added by this turn; empty on failure.
     */
    public List<Message> getAppended() {
        return appended;
    }

    /**
     * Error text to show the user, or null.
     */
    public String getError() {
        return error;
    }
}
