package com.roundtable.engine;

import com.roundtable.AppLogger;
import com.roundtable.models.Message;
import com.roundtable.models.ModelRef;
import com.roundtable.models.RoundTableConfig;
import com.roundtable.providers.ProviderException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sends one user turn to every round table participant in parallel, then asks the chairman
 * to synthesize the answers that came back.
 * <p>
 * A participant failure only removes that participant from the round. The round fails when
 * nobody answered or when the chairman call fails.
 */
public class RoundTableOrchestrator {

    public static final String PARTICIPANT_INSTRUCTION = "\n\nYou are participating in a round table discussion "
        + "with other AI models. Provide your perspective on the user's query.";

    public static final String CHAIRMAN_INSTRUCTION = "\n\nYou are the chairman of a round table discussion. "
        + "Review the perspectives from other AI models and provide a comprehensive summary that "
        + "highlights key insights, areas of agreement and disagreement, and your own judgment on the matter.";

    public static final String RESPONSES_HEADER = "Here are the responses from the round table participants:\n\n";
    public static final String SYNTHESIS_REQUEST =
        "Please synthesize these perspectives and provide your final summary as the chairman.";

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final CompletionEngine engine;
    private final AppLogger logger = AppLogger.get();

    public RoundTableOrchestrator(CompletionEngine engine) {
        this.engine = engine;
    }

    /**
     * Full round: participants, then chairman.
     *
     * @throws ConfigurationException when the roster is empty or no chairman is set
     * @throws ProviderException when every participant failed or the chairman call failed
     */
    public RoundTableOutcome run(RoundTableConfig config, List<Message> messages, String systemPrompt,
                                 double temperature, RoundTableListener listener)
        throws ProviderException, InterruptedException {
        if (config == null || config.isEmpty()) {
            throw new ConfigurationException("No models configured for round table. Please add models first.");
        }
        if (!config.hasChairman()) {
            throw new ConfigurationException("No chairman model selected for round table. Please select a chairman.");
        }
        RoundTableListener progress = listener != null ? listener : RoundTableListener.NONE;
        ModelRef chairman = config.getChairmanModel();

        Map<String, String> responses = runRoundTable(config.getModels(), messages, systemPrompt, temperature, progress);

        progress.chairmanStarted(chairman);
        String summary = chairmanSummary(chairman, messages, systemPrompt, responses, temperature);
        return new RoundTableOutcome(responses, chairmanLabel(chairman), summary);
    }

    /**
     * Ask every participant concurrently and wait for all of them.
     *
     * @return answers of the participants that succeeded, in roster order
     * @throws ProviderException when no participant succeeded
     */
    public Map<String, String> runRoundTable(Map<String, ModelRef> participants, List<Message> messages,
                                             String systemPrompt, double temperature, RoundTableListener listener)
        throws ProviderException, InterruptedException {
        if (participants == null || participants.isEmpty()) {
            throw new ConfigurationException("No models configured for round table. Please add models first.");
        }
        RoundTableListener progress = listener != null ? listener : RoundTableListener.NONE;
        String participantPrompt = nullToEmpty(systemPrompt) + PARTICIPANT_INSTRUCTION;
        List<Message> conversation = List.copyOf(messages);

        progress.roundStarted(participants.size());
        ExecutorService pool = Executors.newFixedThreadPool(participants.size(), participantThreadFactory());
        Map<String, CompletableFuture<ParticipantResult>> futures = new LinkedHashMap<>();
        try {
            for (Map.Entry<String, ModelRef> entry : participants.entrySet()) {
                String name = entry.getKey();
                ModelRef ref = entry.getValue();
                CompletableFuture<ParticipantResult> future = CompletableFuture
                    .supplyAsync(() -> ask(ref, conversation, participantPrompt, temperature), pool)
                    .handle((text, error) -> error == null
                        ? ParticipantResult.success(text)
                        : ParticipantResult.failure(unwrap(error)))
                    .whenComplete((result, ignored) -> progress.participantFinished(name, result.succeeded()));
                futures.put(name, future);
            }

            awaitAll(futures.values());
        } finally {
            pool.shutdownNow();
        }

        Map<String, String> results = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();
        for (Map.Entry<String, CompletableFuture<ParticipantResult>> entry : futures.entrySet()) {
            ParticipantResult result = entry.getValue().join();
            if (result.succeeded()) {
                results.put(entry.getKey(), result.text);
            } else {
                String reason = result.error.getMessage();
                logError("Error getting completion from " + entry.getKey() + ": "
                    + CompletionEngine.describe(result.error));
                errors.add(entry.getKey() + ": " + reason);
            }
        }

        if (results.isEmpty()) {
            throw new ProviderException("All round table models failed: " + String.join("; ", errors));
        }
        if (!errors.isEmpty()) {
            log("Round table continuing with " + results.size() + " of " + participants.size() + " participants");
        }
        return results;
    }

    /**
     * Ask the chairman to synthesize the participants' answers.
     * The chairman sees only the user turns of the conversation, followed by the collected answers.
     */
    public String chairmanSummary(ModelRef chairman, List<Message> messages, String systemPrompt,
                                  Map<String, String> responses, double temperature)
        throws ProviderException, InterruptedException {
        if (chairman == null) {
            throw new ConfigurationException("No chairman model selected for round table. Please select a chairman.");
        }
        String chairmanPrompt = nullToEmpty(systemPrompt) + CHAIRMAN_INSTRUCTION;
        List<Message> chairmanMessages = buildChairmanMessages(messages, responses);
        return engine.getCompletion(chairman.getProvider(), chairman.getModel(), chairmanMessages,
            chairmanPrompt, temperature);
    }

    static List<Message> buildChairmanMessages(List<Message> messages, Map<String, String> responses) {
        List<Message> chairmanMessages = new ArrayList<>();
        for (Message message : messages) {
            if (message.isUser()) {
                chairmanMessages.add(message);
            }
        }

        StringBuilder context = new StringBuilder(RESPONSES_HEADER);
        for (Map.Entry<String, String> entry : responses.entrySet()) {
            context.append("=== ").append(entry.getKey()).append(" ===\n")
                .append(entry.getValue()).append("\n\n");
        }
        context.append(SYNTHESIS_REQUEST);
        chairmanMessages.add(Message.user(context.toString()));
        return chairmanMessages;
    }

    public static String chairmanLabel(ModelRef chairman) {
        return "Chairman (" + chairman.getModel() + ")";
    }

    private String ask(ModelRef ref, List<Message> conversation, String systemPrompt, double temperature) {
        try {
            return engine.getCompletion(ref.getProvider(), ref.getModel(), conversation, systemPrompt, temperature);
        } catch (ProviderException e) {
            throw new CompletionException(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException(e);
        }
    }

    private void awaitAll(Iterable<CompletableFuture<ParticipantResult>> futures) throws InterruptedException {
        List<CompletableFuture<ParticipantResult>> all = new ArrayList<>();
        futures.forEach(all::add);
        try {
            CompletableFuture.allOf(all.toArray(new CompletableFuture[0])).get();
        } catch (ExecutionException e) {
            // Each future is already mapped to a result, so this means a listener threw
            throw new IllegalStateException("Round table participant failed unexpectedly", e.getCause());
        } catch (InterruptedException e) {
            all.forEach(f -> f.cancel(true));
            throw e;
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private ThreadFactory participantThreadFactory() {
        return r -> {
            Thread t = new Thread(r, "round-table-participant-" + THREAD_COUNTER.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[RoundTableOrchestrator] " + message);
        }
    }

    private void logError(String message) {
        if (logger != null) {
            logger.error("[RoundTableOrchestrator] " + message);
        }
    }

    private static final class ParticipantResult {
        private final String text;
        private final Throwable error;

        private ParticipantResult(String text, Throwable error) {
            this.text = text;
            this.error = error;
        }

        static ParticipantResult success(String text) {
            return new ParticipantResult(text, null);
        }

        static ParticipantResult failure(Throwable error) {
            return new ParticipantResult(null, error);
        }

        boolean succeeded() {
            return error == null;
        }
    }
}
