package com.roundtable.providers.chat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.roundtable.models.Provider;
import com.roundtable.settings.ProviderSettings;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Factory for creating and caching chat provider instances.
 */
public class ChatProviderFactory {

    private final ObjectMapper mapper;
    private final ProviderSettings settings;
    private final HttpClient httpClient;
    private final Map<Provider, ChatProvider> providerCache = new EnumMap<>(Provider.class);

    public ChatProviderFactory(ObjectMapper mapper, ProviderSettings settings) {
        this.mapper = mapper;
        this.settings = settings;
        this.httpClient = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    }

    /**
     * Get the chat provider for the given backend. Providers are cached for reuse.
     */
    public synchronized ChatProvider getProvider(Provider provider) {
        if (provider == null) {
            throw new IllegalArgumentException("Provider is required");
        }
        return providerCache.computeIfAbsent(provider, this::createProvider);
    }

    private ChatProvider createProvider(Provider provider) {
        Duration timeout = Duration.ofSeconds(settings.getRequestTimeoutSeconds());
        String baseUrl = settings.getBaseUrl(provider);
        switch (provider) {
            case ANTHROPIC:
                return new AnthropicChatProvider(mapper, httpClient, baseUrl, timeout, settings.getMaxTokens());
            case OPENROUTER:
                return new OpenRouterChatProvider(mapper, httpClient, baseUrl, timeout);
            case OPENAI:
                return new OpenAiChatProvider(mapper, httpClient, baseUrl, timeout);
            default:
                throw new IllegalStateException("Unhandled provider: " + provider);
        }
    }
}
