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
import java.util.Set;

/**
 * OpenAI chat completions.
 * Some models reject both a system role and a temperature; for those the system prompt
 * is sent as the opening user turn and sampling is left at the provider default.
 */
public class OpenAiChatProvider extends AbstractChatProvider {

    static final Set<String> NO_SYSTEM_PROMPT_MODELS = Set.of("o1-preview", "gpt-4.5-preview");

    public OpenAiChatProvider(ObjectMapper mapper, HttpClient httpClient, String baseUrl, Duration requestTimeout) {
        super(mapper, httpClient, stripVersionSuffix(baseUrl), "https://api.openai.com", requestTimeout);
    }

    @Override
    public Provider getProvider() {
        return Provider.OPENAI;
    }

    @Override
    public String complete(String apiKey, String model, List<Message> messages, String systemPrompt, double temperature)
        throws ProviderException, InterruptedException {
        String url = baseUrl + "/v1/chat/completions";
        boolean foldSystemPrompt = NO_SYSTEM_PROMPT_MODELS.contains(model);

        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", model);
        ArrayNode wire = payload.putArray("messages");
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            ObjectNode system = wire.addObject();
            system.put("role", foldSystemPrompt ? "user" : "system");
            system.put("content", systemPrompt);
        }
        appendMessages(wire, messages);
        if (!foldSystemPrompt) {
            payload.put("temperature", temperature);
        }
        payload.put("store", false);

        JsonNode response = sendJsonPost(url, payload, apiKey == null ? null : "Bearer " + apiKey, null);
        return requireText(firstChoiceContent(response), response);
    }

    private static String stripVersionSuffix(String baseUrl) {
        if (baseUrl == null) {
            return null;
        }
        String url = normalizeBaseUrl(baseUrl, "");
        if (url.endsWith("/v1")) {
            url = url.substring(0, url.length() - 3);
        }
        return url;
    }
}
