package com.roundtable.session;

import com.roundtable.models.ChatMode;
import com.roundtable.models.ChatSession;
import com.roundtable.models.Message;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a session log into user/assistant pairs for display.
 * In round table mode all answers to one user turn are joined with a divider and prefixed
 * with their source label.
 */
public final class TranscriptFormatter {

    public static final String DIVIDER = "\n\n---\n\n";

    private TranscriptFormatter() {}

    public static List<TranscriptEntry> format(ChatSession session) {
        boolean roundTable = session.getMode() == ChatMode.ROUND_TABLE;
        List<Message> history = session.getHistory();
        List<TranscriptEntry> entries = new ArrayList<>();

        int i = 0;
        while (i < history.size()) {
            Message message = history.get(i);
            if (!message.isUser()) {
                // assistant output with no user turn before it is not shown
                i++;
                continue;
            }
            List<String> answers = new ArrayList<>();
            int j = i + 1;
            while (j < history.size() && history.get(j).isAssistant()) {
                answers.add(roundTable ? labelled(history.get(j)) : history.get(j).getContent());
                j++;
            }
            entries.add(new TranscriptEntry(message.getContent(),
                String.join(roundTable ? DIVIDER : "\n\n", answers)));
            i = j;
        }
        return entries;
    }

    private static String labelled(Message message) {
        if (message.getSource() != null && !message.getSource().isBlank()) {
            return "**" + message.getSource() + "**: " + message.getContent();
        }
        return message.getContent();
    }
}
