package com.roundtable.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.roundtable.engine.FakeChatProvider;
import com.roundtable.engine.RoundTableOrchestrator;
import com.roundtable.engine.TestProviders;
import com.roundtable.models.ChatMode;
import com.roundtable.models.ChatSession;
import com.roundtable.models.Message;
import com.roundtable.models.ModelRef;
import com.roundtable.models.Provider;
import com.roundtable.providers.ProviderException;
import com.roundtable.storage.JsonStorage;
import com.roundtable.storage.PromptStore;
import com.roundtable.storage.SessionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SessionControllerTest {

    private static final ModelRef GPT = ModelRef.of(Provider.OPENAI, "gpt-4o");

    @TempDir
    Path tempDir;

    private TestProviders providers;
    private SessionStore sessionStore;
    private SessionController controller;

    @BeforeEach
    void setUp() {
        providers = new TestProviders();
        JsonStorage storage = new JsonStorage(new ObjectMapper());
        sessionStore = new SessionStore(tempDir.resolve("sessions"), storage);
        PromptStore promptStore = new PromptStore(tempDir.resolve("prompts"), storage);
        controller = new SessionController(providers.engine, new RoundTableOrchestrator(providers.engine),
            sessionStore, promptStore, "Default prompt");
    }

    private void useRoundTable() {
        controller.switchMode(ChatMode.ROUND_TABLE);
        controller.addParticipant("A", Provider.OPENAI, "m1");
        controller.addParticipant("B", Provider.OPENAI, "m2");
        controller.setChairman(Provider.OPENAI, "m1");
    }

    @Test
    void standardTurnsAlternate() {
        providers.get(Provider.OPENAI).answer("gpt-4o", "reply");

        assertTrue(controller.submit("one", GPT, 0.7).isSuccess());
        assertTrue(controller.submit("two", GPT, 0.7).isSuccess());

        List<Message> history = controller.getSession().getHistory();
        assertEquals(4, history.size());
        assertTrue(history.get(0).isUser());
        assertTrue(history.get(1).isAssistant());
        assertTrue(history.get(2).isUser());
        assertTrue(history.get(3).isAssistant());
        assertTrue(controller.getSession().isWellFormed());
        assertEquals("Ready", controller.getStatus());
    }

    @Test
    void standardTurnSendsHistoryAndSystemPrompt() {
        providers.get(Provider.OPENAI).answer("gpt-4o", "reply");
        controller.setSystemPrompt("Answer in French.");

        controller.submit("Bonjour", GPT, 0.4);

        FakeChatProvider.Call call = providers.get(Provider.OPENAI).calls().get(0);
        assertEquals(List.of(Message.user("Bonjour")), call.messages);
        assertEquals("Answer in French.", call.systemPrompt);
        assertEquals(0.4, call.temperature);
    }

    @Test
    void failedStandardTurnKeepsUserMessageOnly() {
        providers.get(Provider.OPENAI).fail("gpt-4o", "rate limited");

        TurnResult result = controller.submit("hello", GPT, 0.7);

        assertTrue(result.isProcessed());
        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("Failed after 3 attempts"));
        assertTrue(result.getAppended().isEmpty());
        assertEquals(List.of(Message.user("hello")), controller.getSession().getHistory());
        assertEquals(result.getError(), controller.getStatus());
    }

    @Test
    void standardTurnWithoutModelIsRejected() {
        TurnResult result = controller.submit("hello", null, 0.7);

        assertFalse(result.isSuccess());
        assertEquals("No model selected", result.getError());
        assertEquals(1, controller.getSession().getHistory().size());
    }

    @Test
    void blankInputIsIgnored() {
        TurnResult result = controller.submit("   ", GPT, 0.7);

        assertFalse(result.isProcessed());
        assertTrue(controller.getSession().getHistory().isEmpty());
        assertTrue(providers.get(Provider.OPENAI).calls().isEmpty());
    }

    @Test
    void roundTableKeepsSucceedingParticipantsAndChairman() {
        providers.get(Provider.OPENAI)
            .behave("m1", call -> call.systemPrompt.endsWith(RoundTableOrchestrator.PARTICIPANT_INSTRUCTION)
                ? "opinion A" : "final summary")
            .fail("m2", "B is down");
        useRoundTable();

        TurnResult result = controller.submit("Should we?", null, 0.7);

        assertTrue(result.isSuccess(), result.getError());
        List<Message> history = controller.getSession().getHistory();
        assertEquals(3, history.size());
        assertEquals(Message.user("Should we?"), history.get(0));
        assertEquals(Message.assistant("opinion A", "A"), history.get(1));
        assertEquals(Message.assistant("final summary", "Chairman (m1)"), history.get(2));
        assertEquals(history.subList(1, 3), result.getAppended());
    }

    @Test
    void roundTableWhereEveryoneFailsAppendsNothing() {
        providers.get(Provider.OPENAI).fail("m1", "down").fail("m2", "down");
        useRoundTable();

        TurnResult result = controller.submit("Anyone?", null, 0.7);

        assertFalse(result.isSuccess());
        assertTrue(result.getError().startsWith("All round table models failed"));
        assertEquals(List.of(Message.user("Anyone?")), controller.getSession().getHistory());
    }

    @Test
    void roundTableChairmanFailureAppendsNothing() {
        providers.get(Provider.OPENAI)
            .behave("m1", call -> {
                if (call.systemPrompt.endsWith(RoundTableOrchestrator.CHAIRMAN_INSTRUCTION)) {
                    throw new ProviderException("chair unavailable");
                }
                return "opinion";
            })
            .answer("m2", "other opinion");
        useRoundTable();

        TurnResult result = controller.submit("Decide", null, 0.7);

        assertFalse(result.isSuccess());
        assertEquals(1, controller.getSession().getHistory().size());
    }

    @Test
    void roundTableWithoutRosterIsAConfigurationError() {
        controller.switchMode(ChatMode.ROUND_TABLE);

        TurnResult result = controller.submit("Hi", null, 0.7);

        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("No models configured"));
        assertTrue(providers.get(Provider.OPENAI).calls().isEmpty());
    }

    @Test
    void switchingModeClearsHistoryButKeepsPromptAndRoster() {
        providers.get(Provider.OPENAI).answer("gpt-4o", "reply");
        controller.setSystemPrompt("Custom");
        controller.addParticipant("A", Provider.OPENAI, "m1");
        controller.submit("hello", GPT, 0.7);

        String status = controller.switchMode(ChatMode.ROUND_TABLE);

        assertTrue(controller.getSession().getHistory().isEmpty());
        assertTrue(status.contains("Chat history cleared"));
        assertTrue(status.contains("Please set a chairman"));
        assertEquals("Custom", controller.getSession().getSystem());
        assertTrue(controller.getSession().getRoundTable().hasModel("A"));
        assertEquals(ChatMode.ROUND_TABLE, controller.getSession().getMode());
    }

    @Test
    void rejectedModeSwitchKeepsRoundTableHistory() {
        providers.get(Provider.OPENAI)
            .behave("m1", call -> call.systemPrompt.endsWith(RoundTableOrchestrator.PARTICIPANT_INSTRUCTION)
                ? "opinion A" : "summary")
            .answer("m2", "opinion B");
        useRoundTable();
        controller.submit("Topic", null, 0.7);

        assertThrows(IllegalArgumentException.class, () -> controller.switchMode(null));

        assertEquals(ChatMode.ROUND_TABLE, controller.getSession().getMode());
        assertEquals(4, controller.getSession().getHistory().size());
    }

    @Test
    void switchingToSameModeKeepsHistory() {
        providers.get(Provider.OPENAI).answer("gpt-4o", "reply");
        controller.submit("hello", GPT, 0.7);

        String status = controller.switchMode(ChatMode.STANDARD);

        assertEquals(2, controller.getSession().getHistory().size());
        assertEquals("Switched to Standard Chat mode.", status);
    }

    @Test
    void clearResetsHistoryAndPromptButKeepsRosterAndMode() {
        providers.get(Provider.OPENAI).answer("gpt-4o", "reply");
        controller.submit("hello", GPT, 0.7);
        controller.setSystemPrompt("Custom");
        controller.addParticipant("A", Provider.OPENAI, "m1");
        controller.switchMode(ChatMode.ROUND_TABLE);

        assertEquals("Chat session cleared", controller.clear());

        ChatSession session = controller.getSession();
        assertTrue(session.getHistory().isEmpty());
        assertEquals("Default prompt", session.getSystem());
        assertEquals(ChatMode.ROUND_TABLE, session.getMode());
        assertEquals(1, session.getRoundTable().size());
    }

    @Test
    void duplicateParticipantLeavesRosterUnchanged() {
        controller.addParticipant("A", Provider.OPENAI, "m1");

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class, () ->
            controller.addParticipant("A", Provider.ANTHROPIC, "claude-3-opus-20240229"));

        assertEquals("Participant 'A' already exists", error.getMessage());
        assertEquals(ModelRef.of(Provider.OPENAI, "m1"), controller.getSession().getRoundTable().getModels().get("A"));
        assertThrows(IllegalArgumentException.class, () -> controller.addParticipant(" ", Provider.OPENAI, "m1"));
    }

    @Test
    void rosterEditsReportWhatChanged() {
        assertEquals("Added A (m1) to round table participants",
            controller.addParticipant("A", Provider.OPENAI, "m1"));
        controller.addParticipant("B", Provider.OPENAI, "m2");

        assertEquals("Removed participant(s): A", controller.removeParticipants(List.of("A", "ghost")));
        assertEquals("No participants removed", controller.removeParticipants(List.of("ghost")));
        assertEquals("Set chairman to m2 (OpenAI)", controller.setChairman(Provider.OPENAI, "m2"));
        assertEquals("Chairman: m2 (OpenAI)", controller.getChairmanStatus());

        controller.clearParticipants();
        assertTrue(controller.getSession().getRoundTable().isEmpty());
        assertEquals("No chairman selected", controller.getChairmanStatus());
    }

    @Test
    void autosavesOnceHistoryExceedsFourMessages() throws IOException {
        providers.get(Provider.OPENAI).answer("gpt-4o", "reply");

        controller.submit("one", GPT, 0.7);
        controller.submit("two", GPT, 0.7);
        assertTrue(sessionStore.listSessions().isEmpty());

        controller.submit("three", GPT, 0.7);
        List<String> saved = sessionStore.listSessions();
        assertEquals(1, saved.size());
        assertTrue(saved.get(0).startsWith("autosave_"));
    }

    @Test
    void autosaveFailureDoesNotFailTheTurn() throws IOException {
        providers.get(Provider.OPENAI).answer("gpt-4o", "reply");
        // a plain file where the sessions directory should be
        Files.writeString(tempDir.resolve("sessions"), "not a directory");

        controller.submit("one", GPT, 0.7);
        controller.submit("two", GPT, 0.7);
        TurnResult result = controller.submit("three", GPT, 0.7);

        assertTrue(result.isSuccess());
        assertEquals(6, controller.getSession().getHistory().size());
        assertEquals("Ready", controller.getStatus());
    }

    @Test
    void savedSessionLoadsBack() {
        providers.get(Provider.OPENAI).answer("gpt-4o", "reply");
        controller.submit("remember me", GPT, 0.7);
        controller.addParticipant("A", Provider.OPENAI, "m1");

        assertEquals("Session saved to keep.json", controller.saveSession("keep"));
        controller.clear();
        controller.clearParticipants();

        assertEquals("Session loaded from keep.json", controller.loadSession("keep.json"));
        assertEquals(2, controller.getSession().getHistory().size());
        assertTrue(controller.getSession().getRoundTable().hasModel("A"));
    }

    @Test
    void failedLoadKeepsCurrentSession() {
        providers.get(Provider.OPENAI).answer("gpt-4o", "reply");
        controller.submit("still here", GPT, 0.7);

        String status = controller.loadSession("missing.json");

        assertTrue(status.startsWith("Error loading session"));
        assertEquals(2, controller.getSession().getHistory().size());
    }

    @Test
    void blankFileNamesAreReported() {
        assertEquals("Please enter a filename", controller.saveSession(" "));
        assertEquals("No session file selected", controller.loadSession(""));
        assertEquals("No prompt file selected", controller.loadPrompt(null));
        assertEquals("Nothing to save - session is empty", controller.saveSession("empty"));
    }

    @Test
    void loadPromptReplacesSystemPrompt() throws IOException {
        Path prompts = Files.createDirectories(tempDir.resolve("prompts"));
        Files.writeString(prompts.resolve("pirate.json"), "{\"prompt\": \"Talk like a pirate.\"}");

        assertEquals("Successfully loaded prompt from pirate.json", controller.loadPrompt("pirate.json"));
        assertEquals("Talk like a pirate.", controller.getSession().getSystem());

        String status = controller.loadPrompt("absent.json");
        assertTrue(status.startsWith("Error loading prompt"));
        assertEquals("Talk like a pirate.", controller.getSession().getSystem());
    }

    @Test
    void transcriptPairsTurnsWithLabelledAnswers() {
        providers.get(Provider.OPENAI)
            .behave("m1", call -> call.systemPrompt.endsWith(RoundTableOrchestrator.PARTICIPANT_INSTRUCTION)
                ? "opinion A" : "summary")
            .answer("m2", "opinion B");
        useRoundTable();

        controller.submit("Topic", null, 0.7);

        List<TranscriptEntry> transcript = controller.getTranscript();
        assertEquals(1, transcript.size());
        assertEquals("Topic", transcript.get(0).getUser());
        assertEquals("**A**: opinion A" + TranscriptFormatter.DIVIDER + "**B**: opinion B"
            + TranscriptFormatter.DIVIDER + "**Chairman (m1)**: summary", transcript.get(0).getAssistant());
    }
}
