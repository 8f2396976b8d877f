package com.roundtable.engine;

import com.roundtable.models.Message;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Answers of the participants that succeeded, in roster order, plus the chairman's summary.
 */
public class RoundTableOutcome {

    private final Map<String, String> responses;
    private final String chairmanLabel;
    private final String chairmanSummary;

    public RoundTableOutcome(Map<String, String> responses, String chairmanLabel, String chairmanSummary) {
        this.responses = Collections.unmodifiableMap(new LinkedHashMap<>(responses));
        this.chairmanLabel = chairmanLabel;
        this.chairmanSummary = chairmanSummary;
    }

    public Map<String, String> getResponses() {
        return responses;
    }

    public String getChairmanLabel() {
        return chairmanLabel;
    }

    public String getChairmanSummary() {
        return chairmanSummary;
    }

    /**
     * One assistant message per participant answer, then the chairman's.
     */
    public List<Message> toMessages() {
        List<Message> messages = new ArrayList<>();
        for (Map.Entry<String, String> entry : responses.entrySet()) {
            messages.add(Message.assistant(entry.getValue(), entry.getKey()));
        }
        messages.add(Message.assistant(chairmanSummary, chairmanLabel));
        return messages;
    }
}
