package com.roundtable;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.roundtable.controllers.ChatController;
import com.roundtable.controllers.Controller;
import com.roundtable.engine.CompletionEngine;
import com.roundtable.engine.RoundTableOrchestrator;
import com.roundtable.models.ChatSession;
import com.roundtable.models.Provider;
import com.roundtable.providers.chat.ChatProviderFactory;
import com.roundtable.session.SessionController;
import com.roundtable.settings.ProviderSettings;
import com.roundtable.storage.JsonStorage;
import com.roundtable.storage.PromptStore;
import com.roundtable.storage.SessionStore;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.nio.file.Paths;
import java.util.List;

public class Main {

    private static final String VERSION = "1.0.0";
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static AppLogger logger;

    public static void main(String[] args) {
        try {
            AppConfig config = new AppConfig.Builder()
                    .parseArgs(args)
                    .build();

            AppLogger.initialize(config.getLogPath(), config.isDevMode());
            logger = AppLogger.get();

            printBanner(config);

            ProviderSettings providerSettings = ProviderSettings.fromEnvironment(Paths.get(".env"));
            if (!checkCredentials(providerSettings)) {
                logger.console("");
                logger.console("  Error: no API keys found. Set ANTHROPIC_API_KEY, OPENROUTER_API_KEY or");
                logger.console("  OPENAI_API_KEY in the environment or in a .env file.");
                logger.console("");
                System.exit(1);
                return;
            }

            JsonStorage storage = new JsonStorage(objectMapper);
            SessionStore sessionStore = new SessionStore(config.getSessionsPath(), storage);
            PromptStore promptStore = new PromptStore(config.getPromptsPath(), storage);
            String defaultPrompt = promptStore.loadDefaultPrompt();

            CompletionEngine engine = new CompletionEngine(providerSettings,
                new ChatProviderFactory(objectMapper, providerSettings));
            RoundTableOrchestrator orchestrator = new RoundTableOrchestrator(engine);
            SessionController sessionController = new SessionController(engine, orchestrator, sessionStore,
                promptStore, defaultPrompt != null ? defaultPrompt : ChatSession.DEFAULT_SYSTEM_PROMPT);

            Javalin app = Javalin.create(cfg -> {
                cfg.jsonMapper(new JavalinJackson(objectMapper));
                cfg.http.defaultContentType = "application/json";
            });

            List<Controller> controllers = List.of(
                new ChatController(sessionController, providerSettings, objectMapper, new TurnGate())
            );
            for (Controller controller : controllers) {
                controller.registerRoutes(app);
            }
            registerExceptionHandlers(app);

            app.start(config.getPort());

            String url = "http://localhost:" + config.getPort() + "/";
            logger.info("Server started on " + url);
            logger.console("");
            logger.console("  Listening on " + url);
            logger.console("  Data directory: " + config.getDataPath());
            logger.console("  Log file: " + config.getLogPath());
            logger.console("");
            logger.console("========================================");
            logger.console("  Press Ctrl+C to stop");
            logger.console("========================================");

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                app.stop();
                logger.close();
            }));

        } catch (Exception e) {
            System.err.println("Failed to start Round Table: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    private static boolean checkCredentials(ProviderSettings settings) {
        for (Provider provider : Provider.values()) {
            if (settings.isAvailable(provider)) {
                logger.info(provider.getLabel() + " available with models " + settings.getModels(provider));
            } else {
                logger.warn(provider.name() + "_API_KEY is not set; " + provider.getLabel() + " is unavailable");
            }
        }
        return !settings.getAvailableProviders().isEmpty();
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  Round Table v" + VERSION);
        logger.console("========================================");
        logger.console("  Starting server...");
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
    }

    private static void registerExceptionHandlers(Javalin app) {
        app.exception(Exception.class, (e, ctx) -> {
            logger.error("Unhandled exception: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        });
    }
}
