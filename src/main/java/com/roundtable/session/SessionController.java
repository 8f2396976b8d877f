package com.roundtable.session;

import com.roundtable.AppLogger;
import com.roundtable.engine.CompletionEngine;
import com.roundtable.engine.ConfigurationException;
import com.roundtable.engine.RoundTableListener;
import com.roundtable.engine.RoundTableOrchestrator;
import com.roundtable.engine.RoundTableOutcome;
import com.roundtable.models.ChatMode;
import com.roundtable.models.ChatSession;
import com.roundtable.models.Message;
import com.roundtable.models.ModelRef;
import com.roundtable.models.Provider;
import com.roundtable.models.RoundTableConfig;
import com.roundtable.providers.ProviderException;
import com.roundtable.storage.LoadedSession;
import com.roundtable.storage.PromptStore;
import com.roundtable.storage.SessionStore;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Owns the chat session and drives each user turn through either a single completion
 * (standard mode) or a round table.
 * <p>
 * Not thread-safe: callers serialize turns against one controller.
 */
public class SessionController {

    static final int AUTOSAVE_THRESHOLD = 4;
    static final String READY = "Ready";

    private final CompletionEngine engine;
    private final RoundTableOrchestrator orchestrator;
    private final SessionStore sessionStore;
    private final PromptStore promptStore;
    private final String defaultSystemPrompt;
    private final AppLogger logger = AppLogger.get();

    private ChatSession session;
    private volatile String status = READY;

    public SessionController(CompletionEngine engine, RoundTableOrchestrator orchestrator,
                             SessionStore sessionStore, PromptStore promptStore, String defaultSystemPrompt) {
        this.engine = engine;
        this.orchestrator = orchestrator;
        this.sessionStore = sessionStore;
        this.promptStore = promptStore;
        this.defaultSystemPrompt = defaultSystemPrompt != null ? defaultSystemPrompt : "";
        this.session = new ChatSession(this.defaultSystemPrompt);
    }

    public ChatSession getSession() {
        return session;
    }

    /**
     * Progress text of the current or last turn.
     */
    public String getStatus() {
        return status;
    }

    public List<TranscriptEntry> getTranscript() {
        return TranscriptFormatter.format(session);
    }

    /**
     * Run one user turn.
     * <p>
     * The user message stays in the history even when the turn fails; assistant messages are only
     * appended once every model call of the turn has succeeded.
     *
     * @param text the user's input; blank input is ignored
     * @param activeModel the model answering in standard mode (unused in round table mode)
     * @param temperature sampling temperature for every call of the turn
     */
    public TurnResult submit(String text, ModelRef activeModel, double temperature) {
        if (text == null || text.isBlank()) {
            return TurnResult.ignored();
        }

        session.addMessage(Message.user(text));
        try {
            List<Message> reply;
            if (session.getMode() == ChatMode.STANDARD) {
                reply = standardTurn(activeModel, temperature);
            } else {
                reply = roundTableTurn(temperature);
            }
            session.addMessages(reply);
            status = READY;

            if (session.getHistory().size() > AUTOSAVE_THRESHOLD) {
                autosave();
            }
            return TurnResult.success(reply);
        } catch (ConfigurationException e) {
            log("Turn rejected: " + e.getMessage());
            return fail(e.getMessage());
        } catch (ProviderException e) {
            logError("Error processing message: " + e.getMessage());
            return fail(e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logError("Turn interrupted");
            return fail("Request was interrupted");
        } catch (RuntimeException e) {
            logError("Unexpected error processing message", e);
            return fail(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private List<Message> standardTurn(ModelRef activeModel, double temperature)
        throws ProviderException, InterruptedException {
        if (activeModel == null) {
            throw new ConfigurationException("No model selected");
        }
        status = "Processing your request...";
        String response = engine.getCompletion(activeModel.getProvider(), activeModel.getModel(),
            List.copyOf(session.getHistory()), session.getSystem(), temperature);
        return List.of(Message.assistant(response));
    }

    private List<Message> roundTableTurn(double temperature) throws ProviderException, InterruptedException {
        status = "Starting round table discussion...";
        RoundTableOutcome outcome = orchestrator.run(session.getRoundTable(), List.copyOf(session.getHistory()),
            session.getSystem(), temperature, new StatusListener());
        return outcome.toMessages();
    }

    private TurnResult fail(String error) {
        status = error;
        return TurnResult.failure(error);
    }

    private void autosave() {
        try {
            sessionStore.autosave(session);
        } catch (IOException | RuntimeException e) {
            logError("Failed to auto-save session: " + e.getMessage());
        }
    }

    /**
     * Change the chat mode. Existing history is dropped when the mode actually changes, since
     * standard and round table conversations have different shapes; the system prompt and roster stay.
     */
    public String switchMode(ChatMode newMode) {
        if (newMode == null) {
            throw new IllegalArgumentException("Chat mode is required");
        }
        String cleared = "";
        if (session.getMode() != newMode && session.hasContent()) {
            session.clearHistory();
            cleared = " Chat history cleared when switching to " + newMode.getLabel() + " mode.";
        }
        session.setMode(newMode);

        String message;
        if (newMode == ChatMode.ROUND_TABLE) {
            RoundTableConfig roster = session.getRoundTable();
            if (roster.isEmpty()) {
                message = "Switched to Round Table mode. Please add participants.";
            } else if (!roster.hasChairman()) {
                message = "Switched to Round Table mode with " + roster.size()
                    + " participants. Please set a chairman.";
            } else {
                message = "Switched to Round Table mode with " + roster.size() + " participants and chairman.";
            }
        } else {
            message = "Switched to Standard Chat mode.";
        }
        status = message + cleared;
        return status;
    }

    /**
     * Start over: empty history, default system prompt, roster and mode kept.
     */
    public String clear() {
        session.clearHistory();
        session.setSystem(defaultSystemPrompt);
        status = "Chat session cleared";
        return status;
    }

    public void setSystemPrompt(String systemPrompt) {
        session.setSystem(systemPrompt);
    }

    // ===== Round table roster =====

    /**
     * @throws IllegalArgumentException for a blank or duplicate name; the roster is left unchanged
     */
    public String addParticipant(String name, Provider provider, String model) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Please enter a participant name");
        }
        String trimmed = name.trim();
        ModelRef ref = ModelRef.of(provider, model);
        if (!session.getRoundTable().addModel(trimmed, ref)) {
            throw new IllegalArgumentException("Participant '" + trimmed + "' already exists");
        }
        return "Added " + trimmed + " (" + model + ") to round table participants";
    }

    public String removeParticipants(Collection<String> names) {
        List<String> removed = new ArrayList<>();
        if (names != null) {
            for (String name : names) {
                if (session.getRoundTable().removeModel(name)) {
                    removed.add(name);
                }
            }
        }
        return removed.isEmpty()
            ? "No participants removed"
            : "Removed participant(s): " + String.join(", ", removed);
    }

    public String setChairman(Provider provider, String model) {
        ModelRef chairman = ModelRef.of(provider, model);
        session.getRoundTable().setChairman(chairman);
        return "Set chairman to " + chairman;
    }

    public String clearParticipants() {
        session.getRoundTable().clearModels();
        return "Round table participants and chairman cleared";
    }

    public String getChairmanStatus() {
        ModelRef chairman = session.getRoundTable().getChairmanModel();
        return chairman != null ? "Chairman: " + chairman : "No chairman selected";
    }

    // ===== Prompts and persistence =====

    public String loadPrompt(String filename) {
        if (filename == null || filename.isBlank()) {
            return "No prompt file selected";
        }
        try {
            session.setSystem(promptStore.load(filename));
            return "Successfully loaded prompt from " + filename;
        } catch (IOException | RuntimeException e) {
            logError("Error loading prompt " + filename + ": " + e.getMessage());
            return "Error loading prompt: " + e.getMessage();
        }
    }

    public String saveSession(String filename) {
        if (filename == null || filename.isBlank()) {
            return "Please enter a filename";
        }
        try {
            return sessionStore.save(session, filename);
        } catch (IOException | RuntimeException e) {
            logError("Error saving session: " + e.getMessage());
            return "Error saving session: " + e.getMessage();
        }
    }

    /**
     * Replace the current session with one read from disk. On failure the current session is kept.
     */
    public String loadSession(String filename) {
        if (filename == null || filename.isBlank()) {
            return "No session file selected";
        }
        try {
            LoadedSession loaded = sessionStore.load(filename);
            session = loaded.getSession();
            status = READY;
            return loaded.getStatus();
        } catch (IOException | RuntimeException e) {
            logError("Error loading session: " + e.getMessage());
            return "Error loading session: " + e.getMessage();
        }
    }

    public List<String> listSessions() throws IOException {
        return sessionStore.listSessions();
    }

    public List<String> listPrompts() throws IOException {
        return promptStore.listPrompts();
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[SessionController] " + message);
        }
    }

    private void logError(String message) {
        if (logger != null) {
            logger.error("[SessionController] " + message);
        }
    }

    private void logError(String message, Throwable t) {
        if (logger != null) {
            logger.error("[SessionController] " + message, t);
        }
    }

    private class StatusListener implements RoundTableListener {
        @Override
        public void roundStarted(int participantCount) {
            status = "Collecting opinions from " + participantCount + " round table participants...";
        }

        @Override
        public void participantFinished(String name, boolean succeeded) {
            status = succeeded ? "Got response from " + name + "..." : name + " did not respond...";
        }

        @Override
        public void chairmanStarted(ModelRef chairman) {
            status = "Waiting for chairman's summary...";
        }
    }
}
