package com.roundtable.providers.chat;

import com.roundtable.models.Message;
import com.roundtable.models.Provider;
import com.roundtable.providers.ProviderException;

import java.util.List;

/**
 * Interface for AI chat providers.
 * Each implementation maps the conversation onto one backend's API and returns the reply as plain text.
 */
public interface ChatProvider {

    /**
     * The backend this implementation handles.
     */
    Provider getProvider();

    /**
     * Send the conversation and return the assistant's reply.
     *
     * @param apiKey the provider credential
     * @param model the model id to call
     * @param messages the conversation, oldest first
     * @param systemPrompt the system prompt, may be empty
     * @param temperature sampling temperature
     * @return the reply text, never empty
     * @throws ProviderException for any transport, authentication or response-format failure
     */
    String complete(String apiKey, String model, List<Message> messages, String systemPrompt, double temperature)
        throws ProviderException, InterruptedException;
}
