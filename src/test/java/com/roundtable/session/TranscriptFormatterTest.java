package com.roundtable.session;

import com.roundtable.models.ChatMode;
import com.roundtable.models.ChatSession;
import com.roundtable.models.Message;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TranscriptFormatterTest {

    @Test
    void standardModePairsEachUserTurnWithItsAnswer() {
        ChatSession session = new ChatSession();
        session.addMessages(List.of(
            Message.user("q1"), Message.assistant("a1"),
            Message.user("q2"), Message.assistant("a2")));

        List<TranscriptEntry> entries = TranscriptFormatter.format(session);

        assertEquals(2, entries.size());
        assertEquals("q1", entries.get(0).getUser());
        assertEquals("a1", entries.get(0).getAssistant());
        assertEquals("q2", entries.get(1).getUser());
        assertEquals("a2", entries.get(1).getAssistant());
    }

    @Test
    void roundTableAnswersAreLabelledAndDivided() {
        ChatSession session = new ChatSession();
        session.setMode(ChatMode.ROUND_TABLE);
        session.addMessages(List.of(
            Message.user("topic"),
            Message.assistant("x", "A"),
            Message.assistant("y", "Chairman (m1)")));

        List<TranscriptEntry> entries = TranscriptFormatter.format(session);

        assertEquals(1, entries.size());
        assertEquals("**A**: x\n\n---\n\n**Chairman (m1)**: y", entries.get(0).getAssistant());
    }

    @Test
    void unansweredUserTurnShowsEmptyAnswer() {
        ChatSession session = new ChatSession();
        session.addMessages(List.of(Message.user("q1"), Message.assistant("a1"), Message.user("pending")));

        List<TranscriptEntry> entries = TranscriptFormatter.format(session);

        assertEquals(2, entries.size());
        assertEquals("pending", entries.get(1).getUser());
        assertEquals("", entries.get(1).getAssistant());
    }

    @Test
    void leadingAssistantMessagesAreSkipped() {
        ChatSession session = new ChatSession();
        session.addMessages(List.of(Message.assistant("orphan"), Message.user("q"), Message.assistant("a")));

        List<TranscriptEntry> entries = TranscriptFormatter.format(session);

        assertEquals(1, entries.size());
        assertEquals("q", entries.get(0).getUser());
    }
}
