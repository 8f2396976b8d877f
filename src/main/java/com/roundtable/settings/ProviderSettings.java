package com.roundtable.settings;

import com.roundtable.models.Provider;
import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvEntry;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Provider credentials, endpoints and selectable models.
 * A provider without an API key is left out of {@link #getModels()} and reported unavailable.
 */
public class ProviderSettings {

    public static final int DEFAULT_MAX_TOKENS = 8192;
    public static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 300;

    private static final Map<Provider, List<String>> DEFAULT_MODELS = new EnumMap<>(Provider.class);

    static {
        DEFAULT_MODELS.put(Provider.ANTHROPIC,
            List.of("claude-3-7-sonnet-20250219", "claude-3-5-sonnet-20241022", "claude-3-opus-20240229"));
        DEFAULT_MODELS.put(Provider.OPENROUTER, List.of("deepseek/deepseek-r1"));
        DEFAULT_MODELS.put(Provider.OPENAI, List.of("gpt-4o", "o1-preview", "gpt-4.5-preview"));
    }

    private final Map<Provider, String> apiKeys;
    private final Map<Provider, String> baseUrls;
    private final Map<Provider, List<String>> models;
    private final int maxTokens;
    private final int requestTimeoutSeconds;

    private ProviderSettings(Map<Provider, String> apiKeys, Map<Provider, String> baseUrls,
                             Map<Provider, List<String>> models, int maxTokens, int requestTimeoutSeconds) {
        this.apiKeys = apiKeys;
        this.baseUrls = baseUrls;
        this.models = models;
        this.maxTokens = maxTokens;
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    /**
     * Reads the process environment, letting entries of an optional {@code .env} file override it.
     */
    public static ProviderSettings fromEnvironment(Path dotEnvFile) {
        Map<String, String> values = new HashMap<>(System.getenv());
        if (dotEnvFile != null) {
            Path dir = dotEnvFile.toAbsolutePath().getParent();
            Dotenv dotenv = Dotenv.configure()
                .directory(dir != null ? dir.toString() : ".")
                .filename(dotEnvFile.getFileName().toString())
                .ignoreIfMissing()
                .load();
            for (DotenvEntry entry : dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)) {
                values.put(entry.getKey(), entry.getValue());
            }
        }
        return fromValues(values);
    }

    /**
     * Builds settings from flat key/value pairs such as {@code ANTHROPIC_API_KEY}, {@code OPENAI_BASE_URL},
     * {@code OPENROUTER_MODELS} (comma separated), {@code MAX_TOKENS} and {@code REQUEST_TIMEOUT_SECONDS}.
     */
    public static ProviderSettings fromValues(Map<String, String> values) {
        Map<Provider, String> apiKeys = new EnumMap<>(Provider.class);
        Map<Provider, String> baseUrls = new EnumMap<>(Provider.class);
        Map<Provider, List<String>> models = new EnumMap<>(Provider.class);

        for (Provider provider : Provider.values()) {
            String prefix = provider.name();
            String key = values.get(prefix + "_API_KEY");
            String baseUrl = values.get(prefix + "_BASE_URL");
            if (baseUrl != null && !baseUrl.isBlank()) {
                baseUrls.put(provider, baseUrl.trim());
            }
            if (key == null || key.isBlank()) {
                continue;
            }
            apiKeys.put(provider, key.trim());
            List<String> configured = parseList(values.get(prefix + "_MODELS"));
            models.put(provider, configured.isEmpty() ? DEFAULT_MODELS.get(provider) : configured);
        }

        int maxTokens = parsePositive(values.get("MAX_TOKENS"), DEFAULT_MAX_TOKENS, "MAX_TOKENS");
        int timeout = parsePositive(values.get("REQUEST_TIMEOUT_SECONDS"), DEFAULT_REQUEST_TIMEOUT_SECONDS,
            "REQUEST_TIMEOUT_SECONDS");
        return new ProviderSettings(apiKeys, baseUrls, models, maxTokens, timeout);
    }

    public boolean isAvailable(Provider provider) {
        return provider != null && apiKeys.containsKey(provider);
    }

    /**
     * API key for the provider, or null when none is configured.
     */
    public String getApiKey(Provider provider) {
        return apiKeys.get(provider);
    }

    /**
     * Base URL override for the provider, or null to use the public endpoint.
     */
    public String getBaseUrl(Provider provider) {
        return baseUrls.get(provider);
    }

    /**
     * Selectable models of every available provider, in enum order.
     */
    public Map<Provider, List<String>> getModels() {
        return Collections.unmodifiableMap(models);
    }

    public List<String> getModels(Provider provider) {
        return models.getOrDefault(provider, List.of());
    }

    public List<Provider> getAvailableProviders() {
        return new ArrayList<>(models.keySet());
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public int getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    private static List<String> parseList(String raw) {
        List<String> result = new ArrayList<>();
        if (raw == null) {
            return result;
        }
        for (String part : raw.split(",")) {
            if (!part.isBlank()) {
                result.add(part.trim());
            }
        }
        return result;
    }

    private static int parsePositive(String raw, int fallback, String name) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive: " + raw);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not a number: " + raw, e);
        }
    }
}
