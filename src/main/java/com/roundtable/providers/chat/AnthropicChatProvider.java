package com.roundtable.providers.chat;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.roundtable.models.Message;
import com.roundtable.models.Provider;
import com.roundtable.providers.ProviderException;

import java.io.UncheckedIOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Anthropic Messages API.
 * <p>
 * The extended reasoning model is called with a thinking budget over a server-sent event stream;
 * only visible text deltas are kept. When the stream cannot be opened or read, the call is repeated
 * once without streaming.
 */
public class AnthropicChatProvider extends AbstractChatProvider {

    public static final String EXTENDED_THINKING_MODEL = "claude-3-7-sonnet-20250219";
    static final int EXTENDED_MAX_TOKENS = 64000;
    static final int THINKING_BUDGET_TOKENS = 54000;

    private final int maxTokens;

    public AnthropicChatProvider(ObjectMapper mapper, HttpClient httpClient, String baseUrl,
                                 Duration requestTimeout, int maxTokens) {
        super(mapper, httpClient, baseUrl, "https://api.anthropic.com", requestTimeout);
        this.maxTokens = maxTokens;
    }

    @Override
    public Provider getProvider() {
        return Provider.ANTHROPIC;
    }

    @Override
    public String complete(String apiKey, String model, List<Message> messages, String systemPrompt, double temperature)
        throws ProviderException, InterruptedException {
        String url = baseUrl + "/v1/messages";

        if (EXTENDED_THINKING_MODEL.equals(model)) {
            try {
                String streamed = streamWithThinking(url, apiKey, model, messages, systemPrompt);
                if (!streamed.isEmpty()) {
                    return streamed;
                }
                logWarn("Stream for " + model + " produced no text, retrying without streaming");
            } catch (ProviderException | RuntimeException e) {
                logWarn("Streaming error for " + model + ": " + describe(e) + ", retrying without streaming");
            }
        }
        return completeBlocking(url, apiKey, model, messages, systemPrompt, temperature);
    }

    private String completeBlocking(String url, String apiKey, String model, List<Message> messages,
                                    String systemPrompt, double temperature)
        throws ProviderException, InterruptedException {
        ObjectNode payload = basePayload(model, messages, systemPrompt, maxTokens);
        payload.put("temperature", temperature);

        JsonNode response = sendJsonPost(url, payload, null, apiKey);

        StringBuilder text = new StringBuilder();
        JsonNode content = response.path("content");
        if (content.isArray()) {
            for (JsonNode block : content) {
                JsonNode blockText = block.path("text");
                if (blockText.isTextual()) {
                    if (text.length() > 0) {
                        text.append('\n');
                    }
                    text.append(blockText.asText());
                }
            }
        }
        return requireText(text.toString(), response);
    }

    private String streamWithThinking(String url, String apiKey, String model, List<Message> messages,
                                      String systemPrompt)
        throws ProviderException, InterruptedException {
        ObjectNode payload = basePayload(model, messages, systemPrompt, EXTENDED_MAX_TOKENS);
        ObjectNode thinking = payload.putObject("thinking");
        thinking.put("type", "enabled");
        thinking.put("budget_tokens", THINKING_BUDGET_TOKENS);
        payload.put("stream", true);

        HttpRequest request = newJsonRequest(url, payload, null, apiKey)
            .header("Accept", "text/event-stream")
            .build();
        HttpResponse<Stream<String>> response = send(request, HttpResponse.BodyHandlers.ofLines());

        try (Stream<String> lines = response.body()) {
            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                String body = lines.collect(Collectors.joining("\n"));
                throw new ProviderException("Chat stream failed (" + status + "): " + body, status, body);
            }
            return collectTextDeltas(lines.iterator());
        } catch (UncheckedIOException e) {
            throw new ProviderException("Chat stream interrupted: " + describe(e.getCause()), e.getCause());
        }
    }

    /**
     * Concatenate the {@code text_delta} payloads of an event stream in arrival order.
     * Thinking deltas and other events are skipped. A stream that ends before {@code message_stop}
     * is incomplete and rejected.
     */
    String collectTextDeltas(Iterator<String> lines) throws ProviderException {
        StringBuilder text = new StringBuilder();
        boolean stopped = false;
        while (!stopped && lines.hasNext()) {
            String line = lines.next();
            if (!line.startsWith("data:")) {
                continue;
            }
            String data = line.substring("data:".length()).trim();
            if (data.isEmpty()) {
                continue;
            }
            JsonNode event;
            try {
                event = mapper.readTree(data);
            } catch (JsonProcessingException e) {
                throw new ProviderException("Malformed stream event: " + e.getOriginalMessage(), e, null, data, 0);
            }
            String type = event.path("type").asText();
            if ("content_block_delta".equals(type)) {
                JsonNode delta = event.path("delta");
                if ("text_delta".equals(delta.path("type").asText())) {
                    text.append(delta.path("text").asText());
                }
            } else if ("error".equals(type)) {
                throw new ProviderException("Stream error: " + event.path("error").path("message").asText(),
                    null, data);
            } else if ("message_stop".equals(type)) {
                stopped = true;
            }
        }
        if (!stopped) {
            throw new ProviderException("Stream ended before message_stop");
        }
        return text.toString();
    }

    private ObjectNode basePayload(String model, List<Message> messages, String systemPrompt, int tokens) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", model);
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            payload.put("system", systemPrompt);
        }
        payload.put("max_tokens", tokens);

        // The Messages API only knows user and assistant turns
        ArrayNode wire = payload.putArray("messages");
        for (Message message : messages) {
            ObjectNode node = wire.addObject();
            node.put("role", message.isAssistant() ? "assistant" : "user");
            node.put("content", message.getContent());
        }
        return payload;
    }
}
