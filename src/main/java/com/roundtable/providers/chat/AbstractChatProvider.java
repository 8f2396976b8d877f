package com.roundtable.providers.chat;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.roundtable.AppLogger;
import com.roundtable.models.Message;
import com.roundtable.providers.ProviderException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

/**
 * Abstract base class for chat providers with shared HTTP logic.
 */
public abstract class AbstractChatProvider implements ChatProvider {

    protected final ObjectMapper mapper;
    protected final HttpClient httpClient;
    protected final String baseUrl;
    protected final Duration requestTimeout;
    protected final AppLogger logger = AppLogger.get();

    protected AbstractChatProvider(ObjectMapper mapper, HttpClient httpClient, String baseUrl,
                                   String defaultBaseUrl, Duration requestTimeout) {
        this.mapper = mapper;
        this.httpClient = httpClient;
        this.baseUrl = normalizeBaseUrl(baseUrl, defaultBaseUrl);
        this.requestTimeout = requestTimeout;
    }

    /**
     * Build a JSON POST request carrying either a bearer token or Anthropic key headers.
     */
    protected HttpRequest.Builder newJsonRequest(String url, JsonNode payload, String bearerAuth, String anthropicKey)
        throws ProviderException {
        String json;
        try {
            json = mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new ProviderException("Failed to encode request: " + e.getMessage(), e);
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(requestTimeout)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(json));

        if (bearerAuth != null && !bearerAuth.isBlank()) {
            builder.header("Authorization", bearerAuth);
        }
        if (anthropicKey != null && !anthropicKey.isBlank()) {
            builder.header("x-api-key", anthropicKey);
            builder.header("anthropic-version", "2023-06-01");
        }
        return builder;
    }

    /**
     * Send a request, wrapping transport failures into {@link ProviderException}.
     */
    protected <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler)
        throws ProviderException, InterruptedException {
        try {
            return httpClient.send(request, handler);
        } catch (IOException e) {
            throw new ProviderException(getProvider().getLabel() + " request failed: " + describe(e), e);
        }
    }

    /**
     * Send a JSON POST request and return the parsed response.
     */
    protected JsonNode sendJsonPost(String url, JsonNode payload, String bearerAuth, String anthropicKey)
        throws ProviderException, InterruptedException {
        HttpRequest request = newJsonRequest(url, payload, bearerAuth, anthropicKey).build();
        HttpResponse<String> response = send(request, HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        String body = response.body();
        if (status < 200 || status >= 300) {
            throw new ProviderException("Chat request failed (" + status + "): " + body, status, body);
        }
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException("Malformed response from " + getProvider().getLabel() + ": "
                + e.getOriginalMessage(), e, status, body, 0);
        }
    }

    /**
     * Append the conversation as {role, content} objects.
     */
    protected void appendMessages(ArrayNode target, List<Message> messages) {
        for (Message message : messages) {
            ObjectNode node = target.addObject();
            node.put("role", message.getRole().getWireName());
            node.put("content", message.getContent());
        }
    }

    /**
     * Read {@code choices[0].message.content} of an OpenAI-style chat completion, or null.
     */
    protected String firstChoiceContent(JsonNode response) {
        JsonNode choices = response.path("choices");
        if (choices.isArray() && choices.size() > 0) {
            JsonNode content = choices.get(0).path("message").path("content");
            if (content.isTextual()) {
                return content.asText();
            }
        }
        return null;
    }

    /**
     * A reply must carry text; an empty one is treated as a malformed response.
     */
    protected String requireText(String text, JsonNode response) throws ProviderException {
        if (text == null || text.isEmpty()) {
            throw new ProviderException("Empty response from " + getProvider().getLabel(), null,
                response != null ? response.toString() : null);
        }
        return text;
    }

    /**
     * Normalize a base URL by removing trailing slashes.
     */
    protected static String normalizeBaseUrl(String baseUrl, String fallback) {
        String url = (baseUrl == null || baseUrl.isBlank()) ? fallback : baseUrl.trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }

    protected static String describe(Throwable e) {
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message != null && !message.isBlank() ? ": " + message : "");
    }

    protected void logWarn(String message) {
        if (logger != null) {
            logger.warn("[" + getClass().getSimpleName() + "] " + message);
        }
    }
}
