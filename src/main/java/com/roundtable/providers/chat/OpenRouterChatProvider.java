package com.roundtable.providers.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.roundtable.models.Message;
import com.roundtable.models.Provider;
import com.roundtable.providers.ProviderException;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;

public class OpenRouterChatProvider extends AbstractChatProvider {

    static final String NO_DATA = "<No data returned>";

    public OpenRouterChatProvider(ObjectMapper mapper, HttpClient httpClient, String baseUrl, Duration requestTimeout) {
        super(mapper, httpClient, stripApiSuffix(baseUrl), "https://openrouter.ai", requestTimeout);
    }

    @Override
    public Provider getProvider() {
        return Provider.OPENROUTER;
    }

    @Override
    public String complete(String apiKey, String model, List<Message> messages, String systemPrompt, double temperature)
        throws ProviderException, InterruptedException {
        String url = baseUrl + "/api/v1/chat/completions";

        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", model);
        ArrayNode wire = payload.putArray("messages");
        ObjectNode system = wire.addObject();
        system.put("role", "system");
        system.put("content", systemPrompt != null ? systemPrompt : "");
        appendMessages(wire, messages);
        payload.put("temperature", temperature);

        JsonNode response = sendJsonPost(url, payload, apiKey == null ? null : "Bearer " + apiKey, null);
        String content = firstChoiceContent(response);
        if (content == null) {
            // OpenRouter answers 200 with no choices when the upstream model returned nothing
            return NO_DATA;
        }
        return requireText(content, response);
    }

    private static String stripApiSuffix(String baseUrl) {
        if (baseUrl == null) {
            return null;
        }
        String url = normalizeBaseUrl(baseUrl, "");
        if (url.endsWith("/api/v1")) {
            url = url.substring(0, url.length() - 7);
        }
        return url;
    }
}
