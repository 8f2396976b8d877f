package com.roundtable.controllers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.roundtable.AppLogger;
import com.roundtable.TurnGate;
import com.roundtable.engine.ConfigurationException;
import com.roundtable.models.ChatMode;
import com.roundtable.models.ModelRef;
import com.roundtable.models.Provider;
import com.roundtable.session.SessionController;
import com.roundtable.session.TurnResult;
import com.roundtable.settings.ProviderSettings;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * HTTP API over the chat session: turns, mode, round table roster, prompts and saved sessions.
 */
public class ChatController implements Controller {

    private static final double DEFAULT_TEMPERATURE = 0.7;

    private final SessionController sessions;
    private final ProviderSettings providerSettings;
    private final ObjectMapper objectMapper;
    private final TurnGate turnGate;
    private final AppLogger logger;

    public ChatController(SessionController sessions, ProviderSettings providerSettings,
                          ObjectMapper objectMapper, TurnGate turnGate) {
        this.sessions = sessions;
        this.providerSettings = providerSettings;
        this.objectMapper = objectMapper;
        this.turnGate = turnGate;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/session", ctx -> respond(ctx, sessions::getSession));
        app.get("/api/transcript", ctx -> respond(ctx, sessions::getTranscript));
        app.get("/api/status", this::getStatus);
        app.get("/api/providers", this::getProviders);
        app.post("/api/chat", this::chat);
        app.post("/api/mode", this::switchMode);
        app.post("/api/clear", ctx -> respond(ctx, () -> statusBody(sessions.clear())));

        app.post("/api/round-table/participants", this::addParticipant);
        app.delete("/api/round-table/participants/{name}", this::removeParticipant);
        app.delete("/api/round-table/participants", ctx -> respond(ctx, () -> statusBody(sessions.clearParticipants())));
        app.post("/api/round-table/chairman", this::setChairman);

        app.get("/api/sessions", ctx -> respond(ctx, sessions::listSessions));
        app.post("/api/sessions/save", ctx -> withFilename(ctx, sessions::saveSession));
        app.post("/api/sessions/load", ctx -> withFilename(ctx, sessions::loadSession));
        app.get("/api/prompts", ctx -> respond(ctx, sessions::listPrompts));
        app.post("/api/prompts/load", ctx -> withFilename(ctx, sessions::loadPrompt));
    }

    private void getStatus(Context ctx) {
        // Read outside the gate so progress is visible while a turn runs
        ctx.json(Map.of("status", sessions.getStatus()));
    }

    private void getProviders(Context ctx) {
        List<Map<String, Object>> available = new ArrayList<>();
        List<String> unavailable = new ArrayList<>();
        for (Provider provider : Provider.values()) {
            if (providerSettings.isAvailable(provider)) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("provider", provider.getLabel());
                entry.put("models", providerSettings.getModels(provider));
                available.add(entry);
            } else {
                unavailable.add(provider.getLabel());
            }
        }
        ctx.json(Map.of("available", available, "unavailable", unavailable));
    }

    private void chat(Context ctx) {
        respond(ctx, () -> {
            JsonNode json = objectMapper.readTree(ctx.body());
            String message = text(json, "message");
            double temperature = json.hasNonNull("temperature")
                ? json.get("temperature").asDouble()
                : DEFAULT_TEMPERATURE;
            ModelRef active = null;
            if (sessions.getSession().getMode() == ChatMode.STANDARD && !text(json, "model").isBlank()) {
                active = ModelRef.of(Provider.fromLabel(text(json, "provider")), text(json, "model"));
            }

            TurnResult result = sessions.submit(message, active, temperature);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("processed", result.isProcessed());
            body.put("success", result.isSuccess());
            body.put("error", result.getError());
            body.put("appended", result.getAppended());
            body.put("transcript", sessions.getTranscript());
            body.put("status", sessions.getStatus());
            return body;
        });
    }

    private void switchMode(Context ctx) {
        respond(ctx, () -> {
            JsonNode json = objectMapper.readTree(ctx.body());
            ChatMode mode = requireMode(text(json, "mode"));
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", sessions.switchMode(mode));
            body.put("mode", mode);
            body.put("transcript", sessions.getTranscript());
            return body;
        });
    }

    /**
     * Parse the requested mode. Unlike session files, a request must name the mode explicitly.
     */
    static ChatMode requireMode(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Chat mode is required");
        }
        return ChatMode.fromLabel(value);
    }

    private void addParticipant(Context ctx) {
        respond(ctx, () -> {
            JsonNode json = objectMapper.readTree(ctx.body());
            String status = sessions.addParticipant(text(json, "name"),
                Provider.fromLabel(text(json, "provider")), text(json, "model"));
            return rosterBody(status);
        });
    }

    private void removeParticipant(Context ctx) {
        respond(ctx, () -> rosterBody(sessions.removeParticipants(List.of(ctx.pathParam("name")))));
    }

    private void setChairman(Context ctx) {
        respond(ctx, () -> {
            JsonNode json = objectMapper.readTree(ctx.body());
            sessions.setChairman(Provider.fromLabel(text(json, "provider")), text(json, "model"));
            return rosterBody(sessions.getChairmanStatus());
        });
    }

    private void withFilename(Context ctx, Function<String, String> action) {
        respond(ctx, () -> {
            JsonNode json = objectMapper.readTree(ctx.body());
            return statusBody(action.apply(text(json, "filename")));
        });
    }

    private Map<String, Object> rosterBody(String status) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status);
        body.put("round_table", sessions.getSession().getRoundTable());
        return body;
    }

    private static Map<String, Object> statusBody(String status) {
        return Map.of("status", status);
    }

    private static String text(JsonNode json, String field) {
        return json != null && json.hasNonNull(field) ? json.get(field).asText() : "";
    }

    /**
     * Run the action under the turn gate and map failures onto HTTP statuses.
     */
    private void respond(Context ctx, Callable<?> action) {
        try {
            ctx.json(turnGate.run(action));
        } catch (ConfigurationException | IllegalArgumentException | JsonProcessingException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (SecurityException e) {
            logWarn("Rejected path: " + e.getMessage());
            ctx.status(403).json(Controller.errorBody(e));
        } catch (IOException e) {
            logWarn("Request failed: " + e.getMessage());
            ctx.status(502).json(Controller.errorBody(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ctx.status(503).json(Controller.errorBody(e));
        } catch (Exception e) {
            if (logger != null) {
                logger.error("[ChatController] Unhandled exception: " + e.getMessage(), e);
            }
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void logWarn(String message) {
        if (logger != null) {
            logger.warn("[ChatController] " + message);
        }
    }
}
