package com.roundtable.engine;

import com.roundtable.AppLogger;
import com.roundtable.models.Message;
import com.roundtable.models.Provider;
import com.roundtable.providers.ProviderException;
import com.roundtable.providers.chat.ChatProvider;
import com.roundtable.providers.chat.ChatProviderFactory;
import com.roundtable.settings.ProviderSettings;

import java.time.Duration;
import java.util.List;
import java.util.function.Function;

/**
 * Runs one provider call under a bounded retry policy: a fixed number of attempts with a fixed pause
 * between them. Exhausted retries surface as a terminal {@link ProviderException}.
 */
public class CompletionEngine {

    public static final int MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BACKOFF = Duration.ofSeconds(1);

    private final ProviderSettings settings;
    private final Function<Provider, ChatProvider> providers;
    private final Duration backoff;
    private final AppLogger logger = AppLogger.get();

    public CompletionEngine(ProviderSettings settings, ChatProviderFactory factory) {
        this(settings, factory::getProvider, DEFAULT_BACKOFF);
    }

    public CompletionEngine(ProviderSettings settings, Function<Provider, ChatProvider> providers, Duration backoff) {
        this.settings = settings;
        this.providers = providers;
        this.backoff = backoff != null ? backoff : DEFAULT_BACKOFF;
    }

    Duration getBackoff() {
        return backoff;
    }

    public boolean isAvailable(Provider provider) {
        return settings.isAvailable(provider);
    }

    /**
     * Ask a model for the next assistant turn.
     *
     * @throws ConfigurationException when the provider is missing or has no credential
     * @throws ProviderException after {@value #MAX_ATTEMPTS} failed attempts
     */
    public String getCompletion(Provider provider, String model, List<Message> messages,
                                String systemPrompt, double temperature)
        throws ProviderException, InterruptedException {
        if (provider == null) {
            throw new ConfigurationException("No provider selected");
        }
        if (model == null || model.isBlank()) {
            throw new ConfigurationException("No model selected for " + provider.getLabel());
        }
        if (!settings.isAvailable(provider)) {
            throw new ConfigurationException("No API key configured for " + provider.getLabel()
                + ". Set " + provider.name() + "_API_KEY to use it.");
        }

        ChatProvider chatProvider = providers.apply(provider);
        String apiKey = settings.getApiKey(provider);
        Exception lastError = null;

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                return chatProvider.complete(apiKey, model, messages, systemPrompt, temperature);
            } catch (ProviderException | RuntimeException e) {
                lastError = e;
                logWarn("Attempt " + attempt + " failed for " + provider.getLabel() + "/" + model + ": "
                    + e.getMessage() + (attempt < MAX_ATTEMPTS ? ". Retrying..." : ""));
                if (attempt < MAX_ATTEMPTS) {
                    pause();
                }
            }
        }

        String detail = describe(lastError);
        logError("Error getting completion from " + provider.getLabel() + "/" + model
            + " after " + MAX_ATTEMPTS + " attempts: " + detail);
        Integer status = null;
        String body = null;
        if (lastError instanceof ProviderException) {
            status = ((ProviderException) lastError).getStatusCode();
            body = ((ProviderException) lastError).getBody();
        }
        throw new ProviderException("Failed after " + MAX_ATTEMPTS + " attempts: " + detail,
            lastError, status, body, MAX_ATTEMPTS);
    }

    private void pause() throws InterruptedException {
        if (!backoff.isZero() && !backoff.isNegative()) {
            Thread.sleep(backoff.toMillis());
        }
    }

    static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message != null && !message.isBlank() ? ": " + message : "");
    }

    private void logWarn(String message) {
        if (logger != null) {
            logger.warn("[CompletionEngine] " + message);
        }
    }

    private void logError(String message) {
        if (logger != null) {
            logger.error("[CompletionEngine] " + message);
        }
    }
}
